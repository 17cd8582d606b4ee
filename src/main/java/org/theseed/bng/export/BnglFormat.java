/**
 *
 */
package org.theseed.bng.export;

/**
 * Number formatting for BNGL output.  Every floating-point value written to BNGL goes through
 * {@link #toStr(double)} so that the target tool reads back exactly the value we hold.
 *
 */
public final class BnglFormat {

    /** integral values below this magnitude are written without a fraction or exponent */
    private static final double MAX_PLAIN_INTEGER = 1e15;

    private BnglFormat() { }

    /**
     * Format a floating-point value with enough significant digits to be re-parsed exactly.
     * Integral values are written as integers, and a trailing ".0" on a mantissa is dropped.
     *
     * @param value		value to format
     *
     * @return the BNGL text for the value
     */
    public static String toStr(double value) {
        String retVal;
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new IllegalArgumentException("Value " + value + " cannot be written to BNGL.");
        else if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGER)
            retVal = Long.toString((long) value);
        else {
            // Double.toString gives the shortest representation that round-trips.
            String text = Double.toString(value);
            int ePos = text.indexOf('E');
            if (ePos < 0)
                retVal = text;
            else {
                String mantissa = text.substring(0, ePos);
                if (mantissa.endsWith(".0"))
                    mantissa = mantissa.substring(0, mantissa.length() - 2);
                retVal = mantissa + "e" + text.substring(ePos + 1);
            }
        }
        return retVal;
    }

}
