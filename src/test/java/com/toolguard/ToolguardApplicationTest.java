package com.toolguard;

import com.toolguard.policy.ApprovalAdvisor;
import com.toolguard.policy.ApprovalDecision;
import com.toolguard.settings.SecuritySettingsStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ToolguardApplicationTest {

    @Autowired
    private SecuritySettingsStore store;

    @Autowired
    private ApprovalAdvisor advisor;

    @Test
    void contextWiresTheEngine() throws Exception {
        store.init().get(10, TimeUnit.SECONDS);

        assertEquals(SecuritySettingsStore.State.READY, store.getState());
        assertEquals(ApprovalDecision.Outcome.AUTO_DENY,
                advisor.evaluate("exec", Map.of("command", "rm -rf /")).outcome());
        assertEquals(ApprovalDecision.Outcome.AUTO_APPROVE,
                advisor.evaluate("exec", Map.of("command", "ls -la")).outcome());
    }
}
