package org.javai.stl.ast;

import java.math.BigDecimal;

/**
 * Plain decimal rendering shared by interval bounds and predicate thresholds.
 * The output never uses exponent notation, which the tokenizer does not accept.
 */
public final class Numbers {

	private Numbers() {
	}

	public static String format(double value) {
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}
}
