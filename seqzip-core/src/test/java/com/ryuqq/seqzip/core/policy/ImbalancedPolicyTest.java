package com.ryuqq.seqzip.core.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * ImbalancedPolicy Enum 테스트.
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
class ImbalancedPolicyTest {

    @Test
    void values_ContainsThreePolicies() {
        // When
        ImbalancedPolicy[] policies = ImbalancedPolicy.values();

        // Then
        assertEquals(3, policies.length);
        assertEquals(ImbalancedPolicy.TRUNCATE, ImbalancedPolicy.valueOf("TRUNCATE"));
        assertEquals(ImbalancedPolicy.PAD, ImbalancedPolicy.valueOf("PAD"));
        assertEquals(ImbalancedPolicy.FAIL, ImbalancedPolicy.valueOf("FAIL"));
    }
}
