package shaderir.ir;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A counted loop {@code for (int i = init; i < end; i += delta)}. The counter
 * is an implicit local that takes the next local index of the function when
 * the loop is reached.
 */
public final class ForStmt implements Stmt {

	private final int init;
	private final int end;
	private final int delta;
	private final Block body;

	public ForStmt(int init, int end, int delta, Block body) {
		Preconditions.checkArgument(delta != 0, "loop step must not be zero");
		this.init = init;
		this.end = end;
		this.delta = delta;
		this.body = Preconditions.checkNotNull(body, "body");
	}

	public int getInit() {
		return init;
	}

	public int getEnd() {
		return end;
	}

	public int getDelta() {
		return delta;
	}

	public Block getBody() {
		return body;
	}

	@Override public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_ForStmt(this);
	}
	@Override public void match(Stmt.MatcherVoid matcher) {
		matcher.case_ForStmt(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof ForStmt) {
			ForStmt o = (ForStmt) obj;
			return init == o.init
				&& end == o.end
				&& delta == o.delta
				&& body.equals(o.body);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, end, delta, body);
	}

	@Override
	public String toString() {
		return "For(" + init + ", " + end + ", " + delta + ", " + body + ")";
	}
}
