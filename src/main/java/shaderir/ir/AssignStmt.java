package shaderir.ir;

import java.util.Objects;

import com.google.common.base.Preconditions;

public final class AssignStmt implements Stmt {

	private final Expr lhs;
	private final Expr rhs;

	public AssignStmt(Expr lhs, Expr rhs) {
		this.lhs = Preconditions.checkNotNull(lhs, "lhs");
		this.rhs = Preconditions.checkNotNull(rhs, "rhs");
	}

	public Expr getLhs() {
		return lhs;
	}

	public Expr getRhs() {
		return rhs;
	}

	@Override public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_AssignStmt(this);
	}
	@Override public void match(Stmt.MatcherVoid matcher) {
		matcher.case_AssignStmt(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof AssignStmt) {
			AssignStmt o = (AssignStmt) obj;
			return lhs.equals(o.lhs) && rhs.equals(o.rhs);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs);
	}

	@Override
	public String toString() {
		return "Assign(" + lhs + ", " + rhs + ")";
	}
}
