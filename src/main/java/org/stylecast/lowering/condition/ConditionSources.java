package org.stylecast.lowering.condition;

import java.util.regex.Pattern;

final class ConditionSources {

    private static final Pattern SIMPLE = Pattern.compile("!*[\\w$.]+");

    private ConditionSources() {}

    static String wrapUnlessSimple(Condition condition) {
        String source = condition.toSource();
        return SIMPLE.matcher(source).matches() ? source : "(" + source + ")";
    }
}
