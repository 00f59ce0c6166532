package shaderir.ir;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Factory for IR trees. Methods are named after the node they create so that
 * a statically imported tree reads like the shader it describes.
 */
public class Ir {

	private Ir() {
	}

	public static Type Float() {
		return new Type(BasicType.FLOAT);
	}

	public static Type Vec2() {
		return new Type(BasicType.VEC2);
	}

	public static Type Vec3() {
		return new Type(BasicType.VEC3);
	}

	public static Type Vec4() {
		return new Type(BasicType.VEC4);
	}

	public static Type Mat2() {
		return new Type(BasicType.MAT2);
	}

	public static Type Mat3() {
		return new Type(BasicType.MAT3);
	}

	public static Type Mat4() {
		return new Type(BasicType.MAT4);
	}

	public static Type Struct(Type ... members) {
		return new Type(BasicType.STRUCT, ImmutableList.copyOf(members));
	}

	public static List<Type> Types(Type ... types) {
		return ImmutableList.copyOf(types);
	}

	public static NumericExpr Numeric(double value) {
		return new NumericExpr(value);
	}

	public static VarNameExpr VarName(VariableCategory category, int index) {
		return new VarNameExpr(new Variable(category, index));
	}

	public static VarNameExpr Uniform(int index) {
		return VarName(VariableCategory.UNIFORM, index);
	}

	public static VarNameExpr Attribute(int index) {
		return VarName(VariableCategory.ATTRIBUTE, index);
	}

	public static VarNameExpr Varying(int index) {
		return VarName(VariableCategory.VARYING, index);
	}

	public static VarNameExpr Local(int index) {
		return VarName(VariableCategory.LOCAL, index);
	}

	public static BinaryExpr Binary(Op op, Expr left, Expr right) {
		return new BinaryExpr(op, left, right);
	}

	public static Block Block(List<Type> localVars, Stmt ... stmts) {
		return new Block(localVars, ImmutableList.copyOf(stmts));
	}

	public static Block Block(Stmt ... stmts) {
		return Block(ImmutableList.of(), stmts);
	}

	public static BlockStmt BlockStmt(Block block) {
		return new BlockStmt(block);
	}

	public static AssignStmt Assign(Expr lhs, Expr rhs) {
		return new AssignStmt(lhs, rhs);
	}

	public static IfStmt If(Expr cond, Block thenBlock, Block elseBlock) {
		return new IfStmt(cond, thenBlock, elseBlock);
	}

	public static ForStmt For(int init, int end, int delta, Block body) {
		return new ForStmt(init, end, delta, body);
	}

	public static Func Func(String name, List<Type> inParams, List<Type> inOutParams, List<Type> outParams, Block block) {
		return new Func(name, inParams, inOutParams, outParams, block);
	}

	public static Program Program(List<Type> uniforms, List<Type> attributes, List<Type> varyings, Func ... funcs) {
		return new Program(uniforms, attributes, varyings, ImmutableList.copyOf(funcs));
	}

	public static Program Program(Func ... funcs) {
		return Program(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), funcs);
	}
}
