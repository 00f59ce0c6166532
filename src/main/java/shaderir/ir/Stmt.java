package shaderir.ir;

/**
 * An effectful node inside a {@link Block}.
 */
public sealed interface Stmt permits BlockStmt, AssignStmt, IfStmt, ForStmt {

	<T> T match(Matcher<T> s);
	void match(MatcherVoid s);

	public interface Matcher<T> {
		T case_BlockStmt(BlockStmt blockStmt);
		T case_AssignStmt(AssignStmt assignStmt);
		T case_IfStmt(IfStmt ifStmt);
		T case_ForStmt(ForStmt forStmt);
	}

	public interface MatcherVoid {
		void case_BlockStmt(BlockStmt blockStmt);
		void case_AssignStmt(AssignStmt assignStmt);
		void case_IfStmt(IfStmt ifStmt);
		void case_ForStmt(ForStmt forStmt);
	}
}
