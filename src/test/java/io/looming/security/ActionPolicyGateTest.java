package io.looming.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class ActionPolicyGateTest {

    @Test
    void allowsExactAndPrefixPatterns() {
        ActionPolicyGate gate = new ActionPolicyGate(Map.of(
                "poster", List.of("platform:social.post", "platform:blog.*")
        ));
        Assertions.assertTrue(gate.authorize("poster", "platform:social.post").allowed());
        Assertions.assertTrue(gate.authorize("poster", "platform:blog.publish").allowed());
        Assertions.assertFalse(gate.authorize("poster", "platform:social.delete").allowed());
    }

    @Test
    void unknownActorFallsBackToWildcardEntry() {
        ActionPolicyGate gate = new ActionPolicyGate(Map.of(
                "poster", List.of("platform:*"),
                "*", List.of("platform:social.read")
        ));
        Assertions.assertTrue(gate.authorize("guest", "platform:social.read").allowed());
        Assertions.assertFalse(gate.authorize("guest", "platform:social.post").allowed());
    }

    @Test
    void actorWithoutPolicyIsDenied() {
        Authorization decision = new ActionPolicyGate(Map.of("poster", List.of("*"))).authorize("guest", "platform:x.y");
        Assertions.assertFalse(decision.allowed());
        Assertions.assertTrue(decision.reason().contains("guest"));
    }

    @Test
    void masksArgumentKeysOnly() {
        Map<String, String> masked = SensitiveDataMasker.maskedArguments(Map.of("Authorization", "Bearer x", "post_id", "p-1"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("Authorization"));
        Assertions.assertEquals("p-1", masked.get("post_id"));
    }
}
