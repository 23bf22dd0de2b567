package com.proofmend.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Oracle used when no API key is configured. Declines every request.
 */
public class DecliningPatchOracle implements PatchOracle {

    private static final Logger log = LoggerFactory.getLogger(DecliningPatchOracle.class);

    @Override
    public Optional<String> repair(String fileText, List<String> errors) {
        return decline(OracleRole.REPAIR);
    }

    @Override
    public Optional<String> extend(String fileText, String theme) {
        return decline(OracleRole.EXTEND);
    }

    @Override
    public Optional<String> document(String fileText) {
        return decline(OracleRole.DOCUMENT);
    }

    @Override
    public Optional<String> proposePatch(String fileName, List<String> errors) {
        return decline(OracleRole.PATCH);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    private Optional<String> decline(OracleRole role) {
        log.info("[Oracle] No API key configured; skipping {} step", role);
        return Optional.empty();
    }
}
