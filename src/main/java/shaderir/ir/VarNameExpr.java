package shaderir.ir;

import com.google.common.base.Preconditions;

public final class VarNameExpr implements Expr {

	private final Variable variable;

	public VarNameExpr(Variable variable) {
		this.variable = Preconditions.checkNotNull(variable, "variable");
	}

	public Variable getVariable() {
		return variable;
	}

	@Override public <T> T match(Expr.Matcher<T> matcher) {
		return matcher.case_VarNameExpr(this);
	}
	@Override public void match(Expr.MatcherVoid matcher) {
		matcher.case_VarNameExpr(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof VarNameExpr) {
			return variable.equals(((VarNameExpr) obj).variable);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return variable.hashCode();
	}

	@Override
	public String toString() {
		return "VarName(" + variable + ")";
	}
}
