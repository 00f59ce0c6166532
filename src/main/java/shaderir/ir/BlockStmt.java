package shaderir.ir;

import com.google.common.base.Preconditions;

public final class BlockStmt implements Stmt {

	private final Block block;

	public BlockStmt(Block block) {
		this.block = Preconditions.checkNotNull(block, "block");
	}

	public Block getBlock() {
		return block;
	}

	@Override public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_BlockStmt(this);
	}
	@Override public void match(Stmt.MatcherVoid matcher) {
		matcher.case_BlockStmt(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof BlockStmt) {
			return block.equals(((BlockStmt) obj).block);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return block.hashCode();
	}

	@Override
	public String toString() {
		return "BlockStmt(" + block + ")";
	}
}
