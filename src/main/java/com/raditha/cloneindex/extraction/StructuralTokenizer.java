package com.raditha.cloneindex.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps Java declarations to structural token signatures.
 * <p>
 * Control flow and call shape are kept, identifiers and literals are dropped:
 * {@code CALL:save} survives but the variable it is called on does not. Two
 * methods that differ only in naming therefore get the same signature.
 */
public class StructuralTokenizer {

    /**
     * Tokens, dependencies and complexity of one declaration.
     */
    public record Signature(List<String> tokens, Set<String> dependencies, int complexity) {
    }

    /**
     * Signature of a method or constructor: a {@code FUNC:<params>} header
     * followed by the tokens of its body in pre-order.
     */
    public Signature callable(CallableDeclaration<?> callable) {
        List<String> tokens = new ArrayList<>();
        Set<String> dependencies = new LinkedHashSet<>();
        int[] complexity = {1};

        tokens.add("FUNC:" + callable.getParameters().size());
        if (callable instanceof MethodDeclaration method && !method.getType().isVoidType()) {
            tokens.add("RETURN_TYPE");
        }
        for (Node child : callable.getChildNodes()) {
            if (child instanceof BlockStmt) {
                child.walk(node -> {
                    normalizeNode(node, tokens, dependencies);
                    if (isBranch(node)) {
                        complexity[0]++;
                    }
                });
            }
        }
        return new Signature(tokens, dependencies, complexity[0]);
    }

    /**
     * Signature of a type declaration: its shape, not its member bodies.
     */
    public Signature type(TypeDeclaration<?> type) {
        List<String> tokens = new ArrayList<>();
        Set<String> dependencies = new LinkedHashSet<>();

        tokens.add("CLASS:" + type.getMethods().size());
        if (type instanceof ClassOrInterfaceDeclaration cls) {
            for (ClassOrInterfaceType base : cls.getExtendedTypes()) {
                tokens.add("BASE");
                dependencies.add(base.getNameAsString());
            }
            for (ClassOrInterfaceType iface : cls.getImplementedTypes()) {
                tokens.add("IMPLEMENTS");
                dependencies.add(iface.getNameAsString());
            }
        } else if (type instanceof EnumDeclaration enumeration) {
            tokens.add("ENUM:" + enumeration.getEntries().size());
            enumeration.getImplementedTypes().forEach(i -> {
                tokens.add("IMPLEMENTS");
                dependencies.add(i.getNameAsString());
            });
        } else if (type instanceof RecordDeclaration rec) {
            tokens.add("RECORD:" + rec.getParameters().size());
            rec.getImplementedTypes().forEach(i -> {
                tokens.add("IMPLEMENTS");
                dependencies.add(i.getNameAsString());
            });
        }

        for (Node member : type.getMembers()) {
            if (member instanceof FieldDeclaration field) {
                field.getVariables().forEach(v -> tokens.add("FIELD"));
            } else if (member instanceof CallableDeclaration<?> callable) {
                tokens.add("METHOD:" + callable.getParameters().size());
            }
        }
        return new Signature(tokens, dependencies, 1);
    }

    private void normalizeNode(Node node, List<String> tokens, Set<String> dependencies) {
        if (node instanceof MethodCallExpr call) {
            tokens.add("CALL:" + call.getNameAsString());
            tokens.add("ARGS:" + call.getArguments().size());
            dependencies.add(call.getNameAsString());
        } else if (node instanceof ObjectCreationExpr creation) {
            tokens.add("NEW:" + creation.getType().getNameAsString());
            dependencies.add(creation.getType().getNameAsString());
        } else if (node instanceof IfStmt ifStmt) {
            tokens.add("IF");
            ifStmt.getElseStmt()
                    .filter(e -> !(e instanceof IfStmt))
                    .ifPresent(e -> tokens.add("ELSE"));
        } else if (node instanceof ForStmt) {
            tokens.add("FOR");
        } else if (node instanceof ForEachStmt) {
            tokens.add("FOREACH");
        } else if (node instanceof WhileStmt) {
            tokens.add("WHILE");
        } else if (node instanceof DoStmt) {
            tokens.add("DO");
        } else if (node instanceof SwitchStmt) {
            tokens.add("SWITCH");
        } else if (node instanceof SwitchEntry) {
            tokens.add("CASE");
        } else if (node instanceof TryStmt tryStmt) {
            tokens.add("TRY");
            tryStmt.getFinallyBlock().ifPresent(f -> tokens.add("FINALLY"));
        } else if (node instanceof CatchClause catchClause) {
            tokens.add("CATCH:" + catchClause.getParameter().getType().asString());
        } else if (node instanceof BinaryExpr binary) {
            tokens.add("BINOP:" + binary.getOperator().name());
        } else if (node instanceof ConditionalExpr) {
            tokens.add("TERNARY");
        } else if (node instanceof UnaryExpr) {
            tokens.add("UNARY");
        } else if (node instanceof AssignExpr) {
            tokens.add("ASSIGN");
        } else if (node instanceof ReturnStmt returnStmt) {
            tokens.add("RETURN");
            if (returnStmt.getExpression().isPresent()) {
                tokens.add("RETURN_VALUE");
            }
        } else if (node instanceof ThrowStmt) {
            tokens.add("THROW");
        } else if (node instanceof LambdaExpr) {
            tokens.add("LAMBDA");
        } else if (node instanceof BreakStmt) {
            tokens.add("BREAK");
        } else if (node instanceof ContinueStmt) {
            tokens.add("CONTINUE");
        }
    }

    private boolean isBranch(Node node) {
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator() == BinaryExpr.Operator.AND || binary.getOperator() == BinaryExpr.Operator.OR;
        }
        if (node instanceof SwitchEntry entry) {
            return !entry.getLabels().isEmpty();
        }
        return node instanceof IfStmt
                || node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof CatchClause
                || node instanceof ConditionalExpr;
    }
}
