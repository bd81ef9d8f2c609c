package com.specforge.core.pipeline;

import com.specforge.core.error.InvalidPhaseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PhaseRegistry}.
 */
class PhaseRegistryTest {

    @Test
    void register_validPhases_keepsRegistrationOrder() {
        PhaseRegistry registry = new PhaseRegistry()
            .register(new RecordingPhase("validate"))
            .register(new RecordingPhase("generate-tests", "validate"))
            .register(new RecordingPhase("finalize"));

        assertThat(registry.names()).containsExactly("validate", "generate-tests", "finalize");
        assertThat(registry.indexOf("finalize")).isEqualTo(2);
        assertThat(registry.contains("generate-tests")).isTrue();
        assertThat(registry.get("missing")).isEmpty();
    }

    @Test
    void register_duplicateName_isRejected() {
        PhaseRegistry registry = new PhaseRegistry().register(new RecordingPhase("validate"));

        assertThatThrownBy(() -> registry.register(new RecordingPhase("validate")))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("Duplicate phase name");
    }

    @Test
    void register_dependencyNotYetRegistered_isRejected() {
        assertThatThrownBy(() -> new PhaseRegistry().register(new RecordingPhase("review", "implement")))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("which is not registered before it");
    }

    @Test
    void register_nonKebabName_isRejected() {
        assertThatThrownBy(() -> new PhaseRegistry().register(new RecordingPhase("GenerateTests")))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("must be kebab-case");
        assertThatThrownBy(() -> new PhaseRegistry().register(new RecordingPhase("  ")))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("has no name");
    }

    @Test
    void register_nullOutputs_isRejected() {
        Phase noOutputs = new RecordingPhase("validate") {
            @Override
            public List<String> outputs() {
                return null;
            }
        };

        assertThatThrownBy(() -> new PhaseRegistry().register(noOutputs))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("outputs");
    }

    @Test
    void indexOf_unknownPhase_listsKnownPhases() {
        PhaseRegistry registry = new PhaseRegistry().register(new RecordingPhase("validate"));

        assertThatThrownBy(() -> registry.indexOf("deploy"))
            .isInstanceOf(InvalidPhaseException.class)
            .hasMessageContaining("Unknown phase: deploy")
            .hasMessageContaining("validate");
    }
}
