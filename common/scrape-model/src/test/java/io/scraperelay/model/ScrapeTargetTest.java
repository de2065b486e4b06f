package io.scraperelay.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scraperelay.errors.TargetFormatException;
import org.junit.jupiter.api.Test;

class ScrapeTargetTest {

    @Test
    void parsesWildcardTarget() {
        ScrapeTarget target = ScrapeTarget.parse("*:9090");

        assertThat(target.isWildcard()).isTrue();
        assertThat(target.port()).isEqualTo("9090");
    }

    @Test
    void parsesFixedHostTarget() {
        ScrapeTarget target = ScrapeTarget.parse(" 10.0.0.7 : 9100");

        assertThat(target.isWildcard()).isFalse();
        assertThat(target.host()).isEqualTo("10.0.0.7");
        assertThat(target.port()).isEqualTo("9100");
    }

    @Test
    void rejectsTargetsWithoutExactlyOneSeparator() {
        assertThatThrownBy(() -> ScrapeTarget.parse("localhost"))
            .isInstanceOf(TargetFormatException.class)
            .extracting(ex -> ((TargetFormatException) ex).target())
            .isEqualTo("localhost");
        assertThatThrownBy(() -> ScrapeTarget.parse("fe80::1:9100"))
            .isInstanceOf(TargetFormatException.class);
    }
}
