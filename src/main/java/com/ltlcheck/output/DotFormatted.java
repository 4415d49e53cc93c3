package com.ltlcheck.output;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.rewriter.Simplifier;
import java.util.Optional;
import java.util.regex.Pattern;

public interface DotFormatted {
    Pattern RECORD_SPECIAL_CHARACTERS = Pattern.compile("([|{}<>])");

    String dotString();

    static String toDotString(Object object) {
        if (object instanceof Optional<?> optional) {
            return optional.map(DotFormatted::toDotString).orElse("/");
        }
        if (object instanceof LtlFormula<?> formula) {
            return escape(Simplifier.fixpoint(formula).toString());
        }
        return escape((object instanceof DotFormatted format) ? format.dotString() : String.valueOf(object));
    }

    static String escape(String string) {
        return string.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String toRecordString(String string) {
        return RECORD_SPECIAL_CHARACTERS.matcher(string).replaceAll("\\\\$1");
    }
}
