package shaderir.ir;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A lexical scope: local declarations followed by statements.
 */
public final class Block {

	private final ImmutableList<Type> localVars;
	private final ImmutableList<Stmt> stmts;

	public Block(List<Type> localVars, List<Stmt> stmts) {
		this.localVars = ImmutableList.copyOf(localVars);
		this.stmts = ImmutableList.copyOf(stmts);
	}

	public List<Type> getLocalVars() {
		return localVars;
	}

	public List<Stmt> getStmts() {
		return stmts;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Block) {
			Block o = (Block) obj;
			return localVars.equals(o.localVars) && stmts.equals(o.stmts);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(localVars, stmts);
	}

	@Override
	public String toString() {
		return "Block(" + localVars + ", " + stmts + ")";
	}
}
