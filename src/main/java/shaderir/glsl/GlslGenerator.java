package shaderir.glsl;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import shaderir.ir.AssignStmt;
import shaderir.ir.BinaryExpr;
import shaderir.ir.Block;
import shaderir.ir.BlockStmt;
import shaderir.ir.Expr;
import shaderir.ir.ForStmt;
import shaderir.ir.Func;
import shaderir.ir.IfStmt;
import shaderir.ir.NumericExpr;
import shaderir.ir.Program;
import shaderir.ir.Stmt;
import shaderir.ir.Type;
import shaderir.ir.VarNameExpr;
import shaderir.ir.Variable;

/**
 * Renders a {@link Program} as GLSL source.
 *
 * <p>Output order is: struct definitions, uniforms, attributes, varyings,
 * functions. Every line ends with {@code \n} and nested lines are indented
 * with one tab per level. A generator instance renders once; use
 * {@link #generate(Program)} for a one-shot call.
 */
public class GlslGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlslGenerator.class);

    static final String INDENT = "\t";
    static final String NEWLINE = "\n";

    private final Program prog;
    private final StringBuilder sb = new StringBuilder();
    private final StructNames structNames = new StructNames();
    private boolean generated = false;

    public GlslGenerator(Program prog) {
        this.prog = Preconditions.checkNotNull(prog, "prog");
    }

    public static String generate(Program prog) {
        return new GlslGenerator(prog).generate();
    }

    public String generate() {
        Preconditions.checkState(!generated, "generator already used");
        generated = true;
        LOGGER.debug("Generating GLSL: {} uniforms, {} attributes, {} varyings, {} functions",
                prog.getUniforms().size(), prog.getAttributes().size(),
                prog.getVaryings().size(), prog.getFuncs().size());

        collectStructs();

        generateStructDefinitions();
        generateGlobals("uniform", "U", prog.getUniforms());
        generateGlobals("attribute", "A", prog.getAttributes());
        generateGlobals("varying", "V", prog.getVaryings());
        for (Func f : prog.getFuncs()) {
            generateFunc(f);
        }

        if (sb.length() == 0) {
            sb.append(NEWLINE);
        }
        LOGGER.debug("Generated {} characters, {} struct types", sb.length(), structNames.size());
        return sb.toString();
    }

    /**
     * names all struct types in order of first appearance
     */
    private void collectStructs() {
        registerAll(prog.getUniforms());
        registerAll(prog.getAttributes());
        registerAll(prog.getVaryings());
        for (Func f : prog.getFuncs()) {
            registerAll(f.getInParams());
            registerAll(f.getInOutParams());
            registerAll(f.getOutParams());
            collectStructs(f.getBlock());
        }
    }

    private void collectStructs(Block b) {
        registerAll(b.getLocalVars());
        for (Stmt s : b.getStmts()) {
            s.match(new Stmt.MatcherVoid() {
                @Override
                public void case_BlockStmt(BlockStmt blockStmt) {
                    collectStructs(blockStmt.getBlock());
                }

                @Override
                public void case_AssignStmt(AssignStmt assignStmt) {
                    // no declarations
                }

                @Override
                public void case_IfStmt(IfStmt ifStmt) {
                    collectStructs(ifStmt.getThenBlock());
                    collectStructs(ifStmt.getElseBlock());
                }

                @Override
                public void case_ForStmt(ForStmt forStmt) {
                    collectStructs(forStmt.getBody());
                }
            });
        }
    }

    private void registerAll(List<Type> types) {
        for (Type t : types) {
            structNames.register(t);
        }
    }

    private void generateStructDefinitions() {
        for (Type t : structNames.getDefinitionOrder()) {
            sb.append("struct " + structNames.nameOf(t) + " {" + NEWLINE);
            int i = 0;
            for (Type member : t.getSub()) {
                sb.append(INDENT + typeName(member) + " " + StructNames.memberName(i) + ";" + NEWLINE);
                i++;
            }
            sb.append("};" + NEWLINE);
        }
    }

    private void generateGlobals(String qualifier, String prefix, List<Type> types) {
        int i = 0;
        for (Type t : types) {
            sb.append(qualifier + " " + typeName(t) + " " + prefix + i + ";" + NEWLINE);
            i++;
        }
    }

    private String typeName(Type t) {
        if (t.isStruct()) {
            return structNames.nameOf(t);
        }
        return t.getMain().getGlslName();
    }

    private void generateFunc(Func f) {
        LOGGER.trace("Generating function {}", f.getName());
        LocalNames locals = new LocalNames();

        sb.append("void " + f.getName() + "(");
        if (f.getParamCount() == 0) {
            sb.append("void");
        } else {
            boolean first = true;
            first = printParams("in", f.getInParams(), locals, first);
            first = printParams("inout", f.getInOutParams(), locals, first);
            printParams("out", f.getOutParams(), locals, first);
        }
        sb.append(") {" + NEWLINE);

        generateBlock(f.getBlock(), 1, locals);

        sb.append("}" + NEWLINE);
        LOGGER.trace("Function {} declares {} locals", f.getName(), locals.allocated());
    }

    private boolean printParams(String direction, List<Type> params, LocalNames locals, boolean first) {
        for (Type p : params) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(direction + " " + typeName(p) + " " + locals.allocate());
            first = false;
        }
        return first;
    }

    private void generateBlock(Block b, int depth, LocalNames locals) {
        for (Type t : b.getLocalVars()) {
            line(depth, typeName(t) + " " + locals.allocate() + ";");
        }
        for (Stmt s : b.getStmts()) {
            generateStmt(s, depth, locals);
        }
    }

    private void generateStmt(Stmt s, final int depth, final LocalNames locals) {
        s.match(new Stmt.MatcherVoid() {
            @Override
            public void case_BlockStmt(BlockStmt blockStmt) {
                line(depth, "{");
                generateBlock(blockStmt.getBlock(), depth + 1, locals);
                line(depth, "}");
            }

            @Override
            public void case_AssignStmt(AssignStmt assignStmt) {
                line(depth, expr(assignStmt.getLhs(), locals) + " = " + expr(assignStmt.getRhs(), locals) + ";");
            }

            @Override
            public void case_IfStmt(IfStmt ifStmt) {
                line(depth, "if (" + expr(ifStmt.getCond(), locals) + ") {");
                generateBlock(ifStmt.getThenBlock(), depth + 1, locals);
                line(depth, "} else {");
                generateBlock(ifStmt.getElseBlock(), depth + 1, locals);
                line(depth, "}");
            }

            @Override
            public void case_ForStmt(ForStmt forStmt) {
                String counter = locals.allocate();
                line(depth, "for (int " + counter + " = " + GlslLiterals.integer(forStmt.getInit()) + "; "
                        + counter + " < " + GlslLiterals.integer(forStmt.getEnd()) + "; "
                        + GlslLiterals.increment(counter, forStmt.getDelta()) + ") {");
                generateBlock(forStmt.getBody(), depth + 1, locals);
                line(depth, "}");
            }
        });
    }

    private String expr(Expr e, final LocalNames locals) {
        return e.match(new Expr.Matcher<String>() {
            @Override
            public String case_NumericExpr(NumericExpr numericExpr) {
                return GlslLiterals.numeric(numericExpr.getValue());
            }

            @Override
            public String case_VarNameExpr(VarNameExpr varNameExpr) {
                return varName(varNameExpr.getVariable(), locals);
            }

            @Override
            public String case_BinaryExpr(BinaryExpr binaryExpr) {
                return "(" + expr(binaryExpr.getLeft(), locals) + ") "
                        + binaryExpr.getOp().getToken()
                        + " (" + expr(binaryExpr.getRight(), locals) + ")";
            }
        });
    }

    private String varName(Variable v, LocalNames locals) {
        switch (v.getCategory()) {
            case UNIFORM:
                return globalName("U", v);
            case ATTRIBUTE:
                return globalName("A", v);
            case VARYING:
                return globalName("V", v);
            case LOCAL:
                return locals.reference(v.getIndex());
            default:
                throw new Error("Case not possible.");
        }
    }

    private String globalName(String prefix, Variable v) {
        Preconditions.checkElementIndex(v.getIndex(), prog.getVariableCount(v.getCategory()),
                v.getCategory().name().toLowerCase(Locale.ROOT));
        return prefix + v.getIndex();
    }

    private void line(int depth, String text) {
        sb.append(Strings.repeat(INDENT, depth)).append(text).append(NEWLINE);
    }
}
