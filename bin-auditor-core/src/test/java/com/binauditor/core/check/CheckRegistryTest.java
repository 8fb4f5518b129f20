package com.binauditor.core.check;

import com.binauditor.core.model.CheckResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckRegistry}.
 */
class CheckRegistryTest {

    @Test
    void register_withNewId_appendsInOrder() {
        CheckRegistry registry = new CheckRegistry();

        registry.register(new FixedCheck("first"));
        registry.register(new FixedCheck("second"));

        assertThat(registry.count()).isEqualTo(2);
        assertThat(registry.checks()).extracting(ComplianceCheck::getId).containsExactly("first", "second");
        assertThat(registry.find("second")).isPresent();
        assertThat(registry.find("third")).isEmpty();
    }

    @Test
    void register_onDefaultRegistry_growsCountByOne() {
        CheckRegistry registry = CheckRegistry.withDefaultChecks();
        int before = registry.count();

        registry.register(new FixedCheck("custom-policy"));

        assertThat(registry.count()).isEqualTo(before + 1);
        assertThat(registry.checks().get(before).getId()).isEqualTo("custom-policy");
    }

    @Test
    void register_withDuplicateId_throwsAndKeepsRegistryUnchanged() {
        CheckRegistry registry = CheckRegistry.withDefaultChecks();
        int before = registry.count();

        assertThatThrownBy(() -> registry.register(new FixedCheck("hash-integrity")))
            .isInstanceOf(DuplicateCheckIdException.class)
            .hasMessageContaining("hash-integrity");
        assertThat(registry.count()).isEqualTo(before);
    }

    @Test
    void register_withBlankId_throws() {
        CheckRegistry registry = new CheckRegistry();

        assertThatThrownBy(() -> registry.register(new FixedCheck(" ")))
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(DuplicateCheckIdException.class);
    }

    @Test
    void registries_areIndependent() {
        CheckRegistry first = CheckRegistry.withDefaultChecks();
        CheckRegistry second = CheckRegistry.withDefaultChecks();

        first.register(new FixedCheck("only-in-first"));

        assertThat(second.find("only-in-first")).isEmpty();
    }

    @Test
    void checks_returnsImmutableSnapshot() {
        CheckRegistry registry = new CheckRegistry();
        registry.register(new FixedCheck("first"));

        assertThatThrownBy(() -> registry.checks().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    private record FixedCheck(String id) implements ComplianceCheck {
        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDescription() {
            return "fixed";
        }

        @Override
        public CheckResult execute(CheckContext context) {
            return CheckResult.pass(id, "fixed", "ok", null);
        }
    }
}
