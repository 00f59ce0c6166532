package shaderir.ir;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static shaderir.ir.Ir.*;

public class IrTest {

    @Test
    public void testBasicConstruction() {
        // l2 = l0 + l1
        var stmt = Assign(Local(2), Binary(Op.ADD, Local(0), Local(1)));

        assertTrue(stmt.getLhs() instanceof VarNameExpr);
        assertTrue(stmt.getRhs() instanceof BinaryExpr);

        var rhs = (BinaryExpr) stmt.getRhs();
        assertEquals(Op.ADD, rhs.getOp());
        assertEquals(new Variable(VariableCategory.LOCAL, 0), ((VarNameExpr) rhs.getLeft()).getVariable());
        assertEquals(1, ((VarNameExpr) rhs.getRight()).getVariable().getIndex());
    }

    @Test
    public void testStructuralEquality() {
        var a = If(Binary(Op.EQ, Uniform(0), Numeric(1)), Block(Types(Vec2())), Block());
        var b = If(Binary(Op.EQ, Uniform(0), Numeric(1)), Block(Types(Vec2())), Block());
        var c = If(Binary(Op.NOT_EQUAL, Uniform(0), Numeric(1)), Block(Types(Vec2())), Block());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertEquals(Struct(Float(), Struct(Vec3())), Struct(Float(), Struct(Vec3())));
        assertNotEquals(Struct(Float()), Struct(Float(), Float()));
    }

    @Test
    public void testListsAreCopied() {
        List<Type> locals = new ArrayList<>();
        locals.add(Float());
        var block = new Block(locals, new ArrayList<>());
        locals.add(Mat4());

        assertEquals(1, block.getLocalVars().size());
        assertThrows(UnsupportedOperationException.class, () -> block.getLocalVars().add(Vec2()));
    }

    @Test
    public void testMatcher() {
        Expr e = Numeric(3);

        String result = e.match(new Expr.Matcher<String>() {
            @Override
            public String case_NumericExpr(NumericExpr numericExpr) { return "numeric"; }

            @Override
            public String case_VarNameExpr(VarNameExpr varNameExpr) { return "variable"; }

            @Override
            public String case_BinaryExpr(BinaryExpr binaryExpr) { return "binary"; }
        });

        assertEquals("numeric", result);
    }

    @Test
    public void testStmtMatcherVoid() {
        Stmt s = For(0, 10, 1, Block());
        var seen = new StringBuilder();

        s.match(new Stmt.MatcherVoid() {
            @Override
            public void case_BlockStmt(BlockStmt blockStmt) { seen.append("block"); }

            @Override
            public void case_AssignStmt(AssignStmt assignStmt) { seen.append("assign"); }

            @Override
            public void case_IfStmt(IfStmt ifStmt) { seen.append("if"); }

            @Override
            public void case_ForStmt(ForStmt forStmt) { seen.append("for " + forStmt.getEnd()); }
        });

        assertEquals("for 10", seen.toString());
    }

    @Test
    public void testOperatorTokens() {
        assertEquals("+", Op.ADD.getToken());
        assertEquals("==", Op.EQ.getToken());
        assertEquals("<=", Op.LESS_EQUAL.getToken());
        assertEquals("&&", Op.AND_AND.getToken());
        assertEquals("||", Op.OR_OR.getToken());
        assertEquals(">>", Op.RIGHT_SHIFT.getToken());
    }

    @Test
    public void testTypeNames() {
        assertEquals("float", BasicType.FLOAT.getGlslName());
        assertEquals("mat3", BasicType.MAT3.getGlslName());
        assertNull(BasicType.STRUCT.getGlslName());
        assertEquals("struct{float, struct{vec2}}", Struct(Float(), Struct(Vec2())).toString());
    }

    @Test
    public void testProgramVariableCount() {
        var prog = Program(Types(Float(), Float()), Types(Vec2()), Types());
        assertEquals(2, prog.getVariableCount(VariableCategory.UNIFORM));
        assertEquals(1, prog.getVariableCount(VariableCategory.ATTRIBUTE));
        assertEquals(0, prog.getVariableCount(VariableCategory.VARYING));
        assertThrows(IllegalArgumentException.class, () -> prog.getVariableCount(VariableCategory.LOCAL));
    }

    @Test
    public void testFuncParamCount() {
        var f = Func("F0", Types(Float(), Vec2()), Types(Mat2()), Types(Mat4()), Block());
        assertEquals(4, f.getParamCount());
        assertEquals("F0", f.getName());
    }

    @Test
    public void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> For(0, 10, 0, Block()));
        assertThrows(IllegalArgumentException.class, () -> Local(-1));
        assertThrows(IllegalArgumentException.class, () -> Numeric(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Numeric(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> new Type(BasicType.VEC2, Types(Float())));
        assertThrows(IllegalArgumentException.class, () -> Func("", Types(), Types(), Types(), Block()));
        assertThrows(NullPointerException.class, () -> Assign(null, Local(0)));
        assertThrows(NullPointerException.class, () -> BlockStmt(null));
    }

    @Test
    public void testToString() {
        assertEquals("Binary(ADD, VarName(LOCAL#0), Numeric(1.0))",
                Binary(Op.ADD, Local(0), Numeric(1)).toString());
        assertEquals("Block([float], [Assign(VarName(UNIFORM#0), Numeric(0.0))])",
                Block(Types(Float()), Assign(Uniform(0), Numeric(0))).toString());
    }
}
