package com.raditha.cloneindex.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.SourceLocation;
import com.raditha.cloneindex.model.UnitKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Extracts methods, constructors and type declarations from Java source.
 * <p>
 * Each unit keeps its comment-free source so that re-registering a file whose
 * only change is a comment produces the same content hash. Methods without a
 * body (abstract and interface methods) carry no structure and are skipped.
 */
public class JavaStructuralExtractor implements StructuralExtractor {

    private static final Logger logger = LoggerFactory.getLogger(JavaStructuralExtractor.class);

    private final JavaParser parser;
    private final StructuralTokenizer tokenizer;

    public JavaStructuralExtractor() {
        this(new StructuralTokenizer());
    }

    public JavaStructuralExtractor(StructuralTokenizer tokenizer) {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        this.tokenizer = tokenizer;
    }

    @Override
    public List<CodeUnit> extract(Path file) throws IOException {
        return extractFromSource(Files.readString(file), file.toString());
    }

    @Override
    public List<CodeUnit> extractFromSource(String source, @Nullable String filePath) {
        CompilationUnit cu = parse(source, filePath);
        List<CodeUnit> units = new ArrayList<>();

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            StructuralTokenizer.Signature signature = tokenizer.type(type);
            units.add(toUnit(type.getNameAsString(), UnitKind.CLASS, type, signature, filePath));
        }
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            if (method.getBody().isEmpty()) {
                continue;
            }
            units.add(callableUnit(method, filePath));
        }
        for (ConstructorDeclaration constructor : cu.findAll(ConstructorDeclaration.class)) {
            units.add(callableUnit(constructor, filePath));
        }

        units.sort(Comparator.comparingInt((CodeUnit u) -> u.location().startLine())
                .thenComparing(CodeUnit::kind));
        logger.debug("Extracted {} units from {}", units.size(), filePath == null ? "<memory>" : filePath);
        return units;
    }

    private CompilationUnit parse(String source, @Nullable String filePath) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(p -> p.getVerboseMessage())
                    .collect(Collectors.joining("; "));
            throw new ExtractionException("Failed to parse " + (filePath == null ? "source" : filePath) + ": " + problems);
        }
        return result.getResult().get();
    }

    private CodeUnit callableUnit(CallableDeclaration<?> callable, @Nullable String filePath) {
        return toUnit(callable.getNameAsString(), UnitKind.FUNCTION, callable, tokenizer.callable(callable), filePath);
    }

    private CodeUnit toUnit(String name, UnitKind kind, Node node, StructuralTokenizer.Signature signature,
                            @Nullable String filePath) {
        SourceLocation location = node.getRange()
                .map(r -> new SourceLocation(filePath, r.begin.line, r.end.line))
                .orElseGet(() -> new SourceLocation(filePath, 0, 0));
        return new CodeUnit(name, kind, signature.tokens(), location, signature.dependencies(),
                signature.complexity(), withoutComments(node));
    }

    /**
     * Source of a node with every comment removed.
     */
    static String withoutComments(Node node) {
        Node copy = node.clone();
        for (Comment comment : copy.getAllContainedComments()) {
            comment.remove();
        }
        copy.removeComment();
        return copy.toString();
    }
}
