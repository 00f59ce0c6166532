package shaderir.ir;

import com.google.common.base.Preconditions;

public final class NumericExpr implements Expr {

	private final double value;

	public NumericExpr(double value) {
		Preconditions.checkArgument(Double.isFinite(value), "numeric literal must be finite: %s", value);
		this.value = value;
	}

	public double getValue() {
		return value;
	}

	@Override public <T> T match(Expr.Matcher<T> matcher) {
		return matcher.case_NumericExpr(this);
	}
	@Override public void match(Expr.MatcherVoid matcher) {
		matcher.case_NumericExpr(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof NumericExpr) {
			return Double.compare(value, ((NumericExpr) obj).value) == 0;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(value);
	}

	@Override
	public String toString() {
		return "Numeric(" + value + ")";
	}
}
