package io.github.samzhu.quotacycle.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QuotaKeyTest {

    @Test
    void shouldParseAndFormat() {
        QuotaKey key = QuotaKey.parse("anthropic/seven_day");

        assertThat(key.provider()).isEqualTo("anthropic");
        assertThat(key.quotaType()).isEqualTo("seven_day");
        assertThat(key.asString()).isEqualTo("anthropic/seven_day");
    }

    @Test
    void shouldKeepSlashesInQuotaType() {
        QuotaKey key = QuotaKey.parse("acme/models/gpt");

        assertThat(key.quotaType()).isEqualTo("models/gpt");
    }

    @Test
    void shouldRejectMalformedKeys() {
        assertThatThrownBy(() -> QuotaKey.parse("nokey")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuotaKey.parse("/x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuotaKey.parse("x/")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QuotaKey(" ", "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
