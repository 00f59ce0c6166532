package shaderir.ir;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Both branches are always present; an empty else is an empty {@link Block}.
 */
public final class IfStmt implements Stmt {

	private final Expr cond;
	private final Block thenBlock;
	private final Block elseBlock;

	public IfStmt(Expr cond, Block thenBlock, Block elseBlock) {
		this.cond = Preconditions.checkNotNull(cond, "cond");
		this.thenBlock = Preconditions.checkNotNull(thenBlock, "thenBlock");
		this.elseBlock = Preconditions.checkNotNull(elseBlock, "elseBlock");
	}

	public Expr getCond() {
		return cond;
	}

	public Block getThenBlock() {
		return thenBlock;
	}

	public Block getElseBlock() {
		return elseBlock;
	}

	@Override public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_IfStmt(this);
	}
	@Override public void match(Stmt.MatcherVoid matcher) {
		matcher.case_IfStmt(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof IfStmt) {
			IfStmt o = (IfStmt) obj;
			return cond.equals(o.cond)
				&& thenBlock.equals(o.thenBlock)
				&& elseBlock.equals(o.elseBlock);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(cond, thenBlock, elseBlock);
	}

	@Override
	public String toString() {
		return "If(" + cond + ", " + thenBlock + ", " + elseBlock + ")";
	}
}
