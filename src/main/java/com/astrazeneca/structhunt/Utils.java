package com.astrazeneca.structhunt;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class Utils {
    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    /**
     * Method creates string from elements of specified array split by delimiter
     * @param delim the delimiter
     * @param args objects to join
     * @return joined string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    /**
     * Formats a number without trailing zeros, integers without a fraction. NaN is printed as NA.
     * @param pattern DecimalFormat pattern, e.g. "0.00"
     * @param value number to print
     * @return formatted number
     */
    public static String getRoundedValueToPrint(String pattern, double value) {
        if (Double.isNaN(value)) {
            return "NA";
        }
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return new DecimalFormat("0", SYMBOLS).format(value);
        }
        String formatted = new DecimalFormat(pattern, SYMBOLS).format(value);
        return formatted.contains(".") ? formatted.replaceAll("\\.?0+$", "") : formatted;
    }

    public static String printTime(long elapsedMillis) {
        return getRoundedValueToPrint("0.00", elapsedMillis / 1000.0) + "s";
    }
}
