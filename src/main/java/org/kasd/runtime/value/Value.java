package org.kasd.runtime.value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Tagged union of the runtime values. Values are immutable, so copying a value
 * never shares mutable state with the original.
 */
public sealed interface Value permits Value.Null, Value.Int64, Value.Float64, Value.Bool, Value.Str {

	/** The single null value. */
	Null NULL = new Null();

	/**
	 * Returns the type tag of this value.
	 * @return The tag.
	 */
	ValueType type();

	/**
	 * Returns the canonical textual form of this value, as echoed by the interpreter.
	 * @return The canonical text.
	 */
	String render();

	/**
	 * The null value.
	 */
	record Null() implements Value {
		@Override
		public ValueType type() {
			return ValueType.NULL;
		}

		@Override
		public String render() {
			return "null";
		}
	}

	/**
	 * Represents a 64-bit integer value.
	 * @param value The long value.
	 */
	record Int64(long value) implements Value {
		@Override
		public ValueType type() {
			return ValueType.INT;
		}

		@Override
		public String render() {
			return Long.toString(value);
		}
	}

	/**
	 * Represents a 64-bit floating point value.
	 * @param value The double value.
	 */
	record Float64(double value) implements Value {
		@Override
		public ValueType type() {
			return ValueType.FLOAT;
		}

		@Override
		public String render() {
			return formatFloat(value);
		}
	}

	/**
	 * Represents a boolean value.
	 * @param value The boolean value.
	 */
	record Bool(boolean value) implements Value {
		@Override
		public ValueType type() {
			return ValueType.BOOL;
		}

		@Override
		public String render() {
			return value ? "true" : "false";
		}
	}

	/**
	 * Represents a string value. The text is rendered inside double quotes, without escaping.
	 * @param value The string value.
	 */
	record Str(String value) implements Value {
		public Str {
			if (value == null) {
				throw new IllegalArgumentException("String value must not be null; use Value.NULL instead.");
			}
		}

		@Override
		public ValueType type() {
			return ValueType.STRING;
		}

		@Override
		public String render() {
			return "\"" + value + "\"";
		}
	}

	/**
	 * Creates an integer value.
	 * @param value The integer.
	 * @return The value.
	 */
	static Value ofInt(long value) {
		return new Int64(value);
	}

	/**
	 * Creates a floating point value.
	 * @param value The number.
	 * @return The value.
	 */
	static Value ofFloat(double value) {
		return new Float64(value);
	}

	/**
	 * Creates a boolean value.
	 * @param value The boolean.
	 * @return The value.
	 */
	static Value ofBool(boolean value) {
		return new Bool(value);
	}

	/**
	 * Creates a string value.
	 * @param value The text, not null.
	 * @return The value.
	 */
	static Value ofString(String value) {
		return new Str(value);
	}

	/**
	 * Formats a double as the shortest decimal that reads back to the same double.
	 * Plain notation is used unless the magnitude is at least 1e21 or below 1e-7.
	 * @param value The number to format.
	 * @return The formatted number.
	 */
	static String formatFloat(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		}
		if (value == 0.0d) {
			return (1.0d / value) < 0 ? "-0" : "0";
		}
		BigDecimal decimal = shortestDecimal(value).stripTrailingZeros();
		double magnitude = Math.abs(value);
		if (magnitude >= 1e21 || magnitude < 1e-7) {
			return decimal.toString();
		}
		return decimal.toPlainString();
	}

	/**
	 * Finds the decimal with the fewest significant digits that parses back to {@code value}.
	 * Seventeen digits always suffice for a double.
	 */
	private static BigDecimal shortestDecimal(double value) {
		BigDecimal exact = new BigDecimal(value);
		for (int precision = 1; precision < 17; precision++) {
			BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (candidate.doubleValue() == value) {
				return candidate;
			}
		}
		return exact.round(new MathContext(17, RoundingMode.HALF_EVEN));
	}
}
