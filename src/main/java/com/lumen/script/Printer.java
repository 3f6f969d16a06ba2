package com.lumen.script;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Readable ("pr") and display ("str") renderings of runtime values. */
public final class Printer {

    private Printer() {}

    public static String print(Object v) {
        StringBuilder sb = new StringBuilder();
        append(sb, v, true);
        return sb.toString();
    }

    public static String display(Object v) {
        if (v == null) return "";
        StringBuilder sb = new StringBuilder();
        append(sb, v, false);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object v, boolean readable) {
        if (v == null) {
            sb.append("nil");
        } else if (v instanceof String) {
            if (readable) sb.append('"').append(escape((String) v)).append('"');
            else sb.append((String) v);
        } else if (v instanceof Vec) {
            appendAll(sb, ((Vec) v).items, '[', ']', readable);
        } else if (v instanceof List) {
            appendAll(sb, (List<?>) v, '(', ')', readable);
        } else if (v instanceof Map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) v).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                append(sb, e.getKey(), readable);
                sb.append(' ');
                append(sb, e.getValue(), readable);
                if (it.hasNext()) sb.append(", ");
            }
            sb.append('}');
        } else if (v instanceof Throwable) {
            Throwable t = (Throwable) v;
            sb.append("#error[").append(t.getClass().getName()).append(' ');
            append(sb, t.getMessage(), true);
            sb.append(']');
        } else {
            sb.append(v);
        }
    }

    private static void appendAll(StringBuilder sb, List<?> items, char open, char close, boolean readable) {
        sb.append(open);
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(' ');
            append(sb, items.get(i), readable);
        }
        sb.append(close);
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t");
    }
}
