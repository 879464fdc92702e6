package com.ryuqq.pbxwriter.application;

import com.ryuqq.pbxwriter.printer.PrinterConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProjectWriterConfig 테스트.
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
class ProjectWriterConfigTest {

    @Test
    void 기본값() {
        // when
        ProjectWriterConfig config = new ProjectWriterConfig();

        // then
        assertThat(config.printerConfig()).isEqualTo(new PrinterConfig());
        assertThat(config.writeOnlyIfChanged()).isTrue();
    }

    @Test
    void objectVersion_포맷_버전에_따라_결정() {
        ProjectWriterConfig config = new ProjectWriterConfig();

        assertThat(config.objectVersion()).isEqualTo(44);
        assertThat(config.withPrinterConfig(new PrinterConfig().withFormatVersion(31)).objectVersion()).isEqualTo(44);
        assertThat(config.withPrinterConfig(new PrinterConfig().withFormatVersion(32)).objectVersion()).isEqualTo(45);
        assertThat(config.withPrinterConfig(new PrinterConfig().withFormatVersion(50)).objectVersion()).isEqualTo(46);
    }

    @Test
    void withWriteOnlyIfChanged_새_인스턴스_반환() {
        // given
        ProjectWriterConfig config = new ProjectWriterConfig();

        // when
        ProjectWriterConfig updated = config.withWriteOnlyIfChanged(false);

        // then
        assertThat(updated.writeOnlyIfChanged()).isFalse();
        assertThat(config.writeOnlyIfChanged()).isTrue();
    }

    @Test
    void printerConfig_null_거부() {
        assertThatThrownBy(() -> new ProjectWriterConfig(null, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("printerConfig cannot be null");
    }
}
