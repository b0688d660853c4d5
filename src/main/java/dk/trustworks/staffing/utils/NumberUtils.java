package dk.trustworks.staffing.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class NumberUtils {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Division that never fails: a zero (or missing) divisor gives zero.
     */
    public static BigDecimal safeDivide(BigDecimal dividend, BigDecimal divisor, int scale) {
        if (dividend == null || divisor == null || divisor.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale, RoundingMode.HALF_UP);
        }
        return dividend.divide(divisor, scale, RoundingMode.HALF_UP);
    }

    public static BigDecimal safeDivide(BigDecimal dividend, int divisor, int scale) {
        return safeDivide(dividend, BigDecimal.valueOf(divisor), scale);
    }

    /**
     * 75 becomes 0.75, exact.
     */
    public static BigDecimal fraction(int percentage) {
        return BigDecimal.valueOf(percentage).movePointLeft(2);
    }

    public static BigDecimal fraction(BigDecimal percentage) {
        return percentage.movePointLeft(2);
    }

    /**
     * Ratio expressed as a percentage, e.g. 15 of 20 gives 75.
     */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal whole, int scale) {
        return safeDivide(part.multiply(HUNDRED), whole, scale);
    }
}
