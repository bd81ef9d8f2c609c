package com.specforge.core.ai;

import com.specforge.core.error.ProviderFatalException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AiGateway}.
 */
class AiGatewayTest {

    @Test
    void generate_routedPhase_usesPhaseModel() {
        ScriptedAiProvider provider = new ScriptedAiProvider("scripted").thenReturn("a").thenReturn("b");
        AiGateway gateway = new AiGateway(provider,
            new AiRouting("default-model", Map.of("implement", "large-model")), GenerationOptions.defaults());

        gateway.generate("implement", "system", "user");
        gateway.generate("review", "system", "user");

        assertThat(provider.calls()).extracting(GenerationOptions::model)
            .containsExactly("large-model", "default-model");
    }

    @Test
    void generate_unavailableGateway_failsFatally() {
        assertThatThrownBy(() -> AiGateway.unavailable().generate("review", "system", "user"))
            .isInstanceOf(ProviderFatalException.class);
    }
}
