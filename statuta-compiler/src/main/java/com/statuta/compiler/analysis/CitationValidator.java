package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.type.CitationType;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 法条引用校验：条号、款号与法规名。
 */
public final class CitationValidator {

    /** 条号：数字加可选字母后缀，如 {@code 377A} */
    private static final Pattern SECTION = Pattern.compile("^([0-9]+)[A-Za-z]*$");

    /** 款号：数字加可选字母后缀，或纯字母 */
    private static final Pattern SUBSECTION = Pattern.compile("^([0-9]+[A-Za-z]*|[A-Za-z]+)$");

    public static final int MAX_SECTION_NUMBER = 10000;

    private CitationValidator() {}

    /**
     * 校验引用类型
     *
     * @return 错误描述；合法时返回 null
     */
    public static String validate(CitationType citation) {
        String section = citation.getSection();
        Matcher m = SECTION.matcher(section);
        if (!m.matches()) {
            return "Invalid section number '" + section + "' in citation";
        }
        BigInteger number = new BigInteger(m.group(1));
        if (number.signum() <= 0 || number.compareTo(BigInteger.valueOf(MAX_SECTION_NUMBER)) > 0) {
            return "Section number '" + section + "' is outside 1.." + MAX_SECTION_NUMBER;
        }
        String subsection = citation.getSubsection();
        if (subsection != null && !SUBSECTION.matcher(subsection).matches()) {
            return "Invalid subsection '" + subsection + "' in citation of section " + section;
        }
        if (citation.getAct() == null || citation.getAct().trim().isEmpty()) {
            return "Citation of section " + section + " names no act";
        }
        return null;
    }
}
