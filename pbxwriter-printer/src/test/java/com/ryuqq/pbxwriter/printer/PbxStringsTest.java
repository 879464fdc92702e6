package com.ryuqq.pbxwriter.printer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PbxStrings escape 규칙 테스트.
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
class PbxStringsTest {

    @ParameterizedTest
    @ValueSource(strings = {"foo", "PBXGroup", "main.c", "$SRCROOT/lib/libfoo.a", "_private", "A1.b2/c3"})
    void escape_안전한_문자만_있으면_따옴표_없음(String value) {
        assertThat(PbxStrings.needsQuotes(value)).isFalse();
        assertThat(PbxStrings.escape(value)).isEqualTo(value);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a b", "<group>", "a-b", "$(SRCROOT)", "x=y", "tab\there", "héllo", "a,b"})
    void escape_안전하지_않은_문자가_있으면_따옴표(String value) {
        assertThat(PbxStrings.needsQuotes(value)).isTrue();
        assertThat(PbxStrings.escape(value)).isEqualTo("\"" + value + "\"");
    }

    @Test
    void escape_빈_문자열은_따옴표_쌍() {
        assertThat(PbxStrings.escape("")).isEqualTo("\"\"");
    }

    @Test
    void escape_주석_시작_시퀀스는_따옴표() {
        // given: 안전한 문자만으로 구성되어도 "//"는 주석으로 해석됨
        String value = "http//example";

        // when & then
        assertThat(PbxStrings.escape(value)).isEqualTo("\"http//example\"");
        assertThat(PbxStrings.escape("a/b")).isEqualTo("a/b");
    }

    @Test
    void escape_따옴표와_역슬래시만_escape() {
        assertThat(PbxStrings.escape("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(PbxStrings.escape("C:\\dir")).isEqualTo("\"C:\\\\dir\"");
        assertThat(PbxStrings.escape("line\nbreak")).isEqualTo("\"line\nbreak\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"", "\\", "a\"b\\c", "\\\"", "\"\"\"", "end\\"})
    void escape_결과에_escape되지_않은_따옴표나_역슬래시가_없음(String value) {
        // when
        String escaped = PbxStrings.escape(value);
        String body = escaped.substring(1, escaped.length() - 1);

        // then
        assertThat(escaped).startsWith("\"").endsWith("\"");
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\') {
                assertThat(body.charAt(i + 1)).isIn('"', '\\');
                i++;
            } else {
                assertThat(c).isNotEqualTo('"');
            }
        }
    }

    @Test
    void escape_null_거부() {
        assertThatThrownBy(() -> PbxStrings.escape(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
