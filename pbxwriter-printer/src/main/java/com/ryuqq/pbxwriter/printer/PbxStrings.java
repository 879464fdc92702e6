package com.ryuqq.pbxwriter.printer;

/**
 * PBX 문자열 escape 규칙.
 *
 * <p>다음 중 하나에 해당하면 큰따옴표로 감쌉니다:</p>
 * <ul>
 *   <li>빈 문자열</li>
 *   <li>주석 시작 시퀀스 {@code //} 포함</li>
 *   <li>{@code [A-Za-z0-9$_./]} 밖의 문자 포함</li>
 * </ul>
 *
 * <p>감쌀 때는 {@code "}와 {@code \} 앞에만 역슬래시를 붙입니다. 다른 문자는 그대로 둡니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxStrings {

    private PbxStrings() {
    }

    /**
     * 따옴표가 필요한지 확인.
     *
     * @param value 원본 문자열
     * @return 따옴표가 필요하면 true
     */
    public static boolean needsQuotes(String value) {
        if (value.isEmpty() || value.contains("//")) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!isUnquotedSafe(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * escape된 문자열 반환.
     *
     * @param value 원본 문자열
     * @return 출력용 문자열
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static String escape(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        StringBuilder out = new StringBuilder(value.length() + 2);
        appendEscaped(out, value);
        return out.toString();
    }

    /**
     * escape된 문자열을 버퍼에 추가.
     *
     * @param out 출력 버퍼
     * @param value 원본 문자열
     */
    static void appendEscaped(StringBuilder out, String value) {
        boolean quote = needsQuotes(value);
        if (quote) {
            out.append('"');
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        if (quote) {
            out.append('"');
        }
    }

    private static boolean isUnquotedSafe(char c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '$' || c == '_' || c == '.' || c == '/';
    }
}
