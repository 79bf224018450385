package org.introspect.runtime;

import java.util.List;

/**
 * The subset of printf formatting that generated code relies on: {@code d i u x c s p} conversions with the
 * {@code hh h l ll z} length modifiers and {@code %%}. Output matches glibc, including {@code (nil)} and
 * {@code (null)}.
 */
public final class CFormatter {

    private CFormatter() {
    }

    public static String format(String format, List<Object> arguments) {
        StringBuilder sb = new StringBuilder();
        int next = 0;
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i++);
            if (c != '%') {
                sb.append(c);
                continue;
            }
            if (i >= format.length()) {
                throw new IllegalArgumentException("Dangling '%' at the end of format \"" + format + "\"");
            }
            if (format.charAt(i) == '%') {
                sb.append('%');
                i++;
                continue;
            }
            int lengthStart = i;
            while (i < format.length() && "hlz".indexOf(format.charAt(i)) >= 0) {
                i++;
            }
            String length = format.substring(lengthStart, i);
            if (i >= format.length()) {
                throw new IllegalArgumentException("Incomplete conversion in format \"" + format + "\"");
            }
            char conversion = format.charAt(i++);
            if (next >= arguments.size()) {
                throw new IllegalArgumentException("Format \"" + format + "\" needs more than "
                        + arguments.size() + " arguments");
            }
            Object argument = arguments.get(next++);
            switch (conversion) {
                case 'd':
                case 'i':
                    sb.append(signed(toLong(argument), length));
                    break;
                case 'u':
                    sb.append(Long.toUnsignedString(unsigned(toLong(argument), length)));
                    break;
                case 'x':
                    sb.append(Long.toHexString(unsigned(toLong(argument), length)));
                    break;
                case 'c':
                    sb.append((char) (toLong(argument) & 0xff));
                    break;
                case 's':
                    sb.append(string(argument));
                    break;
                case 'p':
                    sb.append(pointer(argument));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported conversion '%" + length + conversion
                            + "' in format \"" + format + "\"");
            }
        }
        return sb.toString();
    }

    private static long signed(long value, String length) {
        switch (length) {
            case "hh":
                return (byte) value;
            case "h":
                return (short) value;
            case "":
                return (int) value;
            default:
                return value;
        }
    }

    private static long unsigned(long value, String length) {
        switch (length) {
            case "hh":
                return value & 0xffL;
            case "h":
                return value & 0xffffL;
            case "":
                return value & 0xffffffffL;
            default:
                return value;
        }
    }

    private static long toLong(Object argument) {
        if (argument instanceof Long) {
            return (Long) argument;
        }
        if (argument instanceof CPointer) {
            return ((CPointer) argument).getAddress();
        }
        throw new IllegalArgumentException("Integer conversion applied to " + describe(argument));
    }

    private static String string(Object argument) {
        if (!(argument instanceof CPointer)) {
            throw new IllegalArgumentException("%s applied to " + describe(argument));
        }
        CPointer pointer = (CPointer) argument;
        if (pointer.isNull()) {
            return "(null)";
        }
        if (pointer.getTarget() == null) {
            throw new IllegalArgumentException("%s applied to " + pointer + " which does not point at a string");
        }
        return pointer.getTarget();
    }

    private static String pointer(Object argument) {
        if (argument instanceof CPointer) {
            return argument.toString();
        }
        long address = toLong(argument);
        return address == 0 ? "(nil)" : "0x" + Long.toHexString(address);
    }

    private static String describe(Object argument) {
        return argument == null ? "null" : argument.getClass().getSimpleName() + " " + argument;
    }
}
