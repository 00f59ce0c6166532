package shaderir.ir;

import java.util.Objects;

import com.google.common.base.Preconditions;

public final class BinaryExpr implements Expr {

	private final Op op;
	private final Expr left;
	private final Expr right;

	public BinaryExpr(Op op, Expr left, Expr right) {
		this.op = Preconditions.checkNotNull(op, "op");
		this.left = Preconditions.checkNotNull(left, "left");
		this.right = Preconditions.checkNotNull(right, "right");
	}

	public Op getOp() {
		return op;
	}

	public Expr getLeft() {
		return left;
	}

	public Expr getRight() {
		return right;
	}

	@Override public <T> T match(Expr.Matcher<T> matcher) {
		return matcher.case_BinaryExpr(this);
	}
	@Override public void match(Expr.MatcherVoid matcher) {
		matcher.case_BinaryExpr(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof BinaryExpr) {
			BinaryExpr o = (BinaryExpr) obj;
			return op == o.op
				&& left.equals(o.left)
				&& right.equals(o.right);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, left, right);
	}

	@Override
	public String toString() {
		return "Binary(" + op + ", " + left + ", " + right + ")";
	}
}
