package com.proofmend;

import com.proofmend.cli.CliRunner;
import com.proofmend.llm.PatchOracle;
import com.proofmend.orchestrator.RepairOrchestrator;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ProofMendApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PatchOracle patchOracle;

    @Test
    void testContextWiresWithDecliningOracle() {
        assertNotNull(context.getBean(RepairOrchestrator.class));
        assertFalse(patchOracle.isAvailable(), "No API key in the test profile");
    }

    @Test
    void testCliRunnerIsDisabledInTests() {
        assertTrue(context.getBeansOfType(CliRunner.class).isEmpty());
    }
}
