package shaderir.ir;

/**
 * A value-producing node. Rendered only by textual substitution.
 */
public sealed interface Expr permits NumericExpr, VarNameExpr, BinaryExpr {

	<T> T match(Matcher<T> s);
	void match(MatcherVoid s);

	public interface Matcher<T> {
		T case_NumericExpr(NumericExpr numericExpr);
		T case_VarNameExpr(VarNameExpr varNameExpr);
		T case_BinaryExpr(BinaryExpr binaryExpr);
	}

	public interface MatcherVoid {
		void case_NumericExpr(NumericExpr numericExpr);
		void case_VarNameExpr(VarNameExpr varNameExpr);
		void case_BinaryExpr(BinaryExpr binaryExpr);
	}
}
