package com.lendledger.access;

import com.lendledger.config.AppProps;
import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Claims from {@code app.access.claims}: action id -> list of caller addresses.
 * An action without an entry is denied to everyone while enforcement is on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredAuthorizationCheck implements AuthorizationCheck {

    private final AppProps props;

    @Override
    public void requireClaim(String action, String caller) {
        AppProps.Access access = props.getAccess();
        if (!access.isEnforce()) return;
        if (AddressUtil.isZeroOrInvalid(caller)) {
            throw LedgerException.of(ErrorCode.MISSING_CLAIM, "no valid caller for " + action);
        }
        List<String> allowed = access.getClaims().getOrDefault(action, List.of());
        boolean ok = allowed.stream().anyMatch(a -> a.equalsIgnoreCase(caller));
        if (!ok) {
            log.warn("[access] {} denied for {}", action, caller);
            throw LedgerException.of(ErrorCode.MISSING_CLAIM, caller + " lacks claim " + action);
        }
    }
}
