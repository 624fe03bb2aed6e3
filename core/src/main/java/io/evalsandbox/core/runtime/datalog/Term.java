package io.evalsandbox.core.runtime.datalog;

/** A Datalog term: a constant (symbol, string, integer) or a variable. Immutable value objects. */
interface Term {

    /** Whether this term contains no variables. */
    default boolean isGround() {
        return !(this instanceof Var);
    }

    /** Text written by {@code print}: strings without quotes, everything else as rendered. */
    default String displayText() {
        return toString();
    }

    /** Lowercase identifier constant, e.g. {@code john}. */
    record Symbol(String name) implements Term {
        @Override
        public String toString() {
            return name;
        }
    }

    /** Double-quoted string constant. */
    record Str(String value) implements Term {
        @Override
        public String displayText() {
            return value;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
    }

    /** 64-bit integer constant. */
    record Int(long value) implements Term {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /** Variable; names start with an uppercase letter or underscore. */
    record Var(String name) implements Term {
        @Override
        public String toString() {
            return name;
        }
    }
}
