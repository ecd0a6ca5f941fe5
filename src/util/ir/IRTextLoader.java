package util.ir;

import exception.CompileException;
import frontend.grammar.LoopIRBaseVisitor;
import frontend.grammar.LoopIRLexer;
import frontend.grammar.LoopIRParser;
import ir.Builder;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.VectorType;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.instructions.ElementShuffleInst.VectorElement;
import ir.value.instructions.LoopInst;
import ir.value.instructions.OffloadedInst;
import util.LoggingManager;
import util.logging.Logger;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * IR 文本加载器
 *
 * 把 {@code LoopIR.g4} 描述的文本解析成 IR 节点，主要给测试和调试用：
 * <pre>
 *   %L = range_for %c0, %c10
 *   %i = loop_index %L, 0
 *   %x = add i32 %i, %c1
 * </pre>
 * 所有语法错误和语义错误都会被收集，最后一起通过 {@link IRTextParseException} 报告
 */
public class IRTextLoader {
    private static final Logger log = LoggingManager.getLogger(IRTextLoader.class);

    private IRTextLoader() {
    }

    /**
     * 从文件路径加载
     */
    public static IRText loadFromFile(Path path) throws IOException, IRTextParseException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.getFileName().toString());
    }

    /**
     * 从 classpath 资源加载，例如 "ir/shuffle.ir"
     */
    public static IRText loadFromResource(String resourcePath) throws IOException, IRTextParseException {
        try (InputStream inputStream = IRTextLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            return parse(content, resourcePath);
        }
    }

    /**
     * 从字符串内容解析
     *
     * @param content    IR 文本
     * @param sourceName 出错时报告的来源名
     */
    public static IRText parse(String content, String sourceName) throws IRTextParseException {
        String[] lines = content.split("\\R", -1);
        List<IRTextParseException.ParseError> errors = new ArrayList<>();
        BaseErrorListener listener = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                    int line, int charPositionInLine, String msg, RecognitionException e) {
                errors.add(new IRTextParseException.ParseError(line, lineAt(lines, line),
                        "Syntax error at column " + charPositionInLine + ": " + msg));
            }
        };

        LoopIRLexer lexer = new LoopIRLexer(CharStreams.fromString(content, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        LoopIRParser parser = new LoopIRParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        LoopIRParser.ProgramContext program = parser.program();
        if (!errors.isEmpty()) {
            throw new IRTextParseException(sourceName, errors);
        }

        GraphBuilder graph = new GraphBuilder(lines, errors);
        for (LoopIRParser.DefinitionContext definition : program.definition()) {
            graph.define(definition);
        }
        if (!errors.isEmpty()) {
            throw new IRTextParseException(sourceName, errors);
        }

        log.debug("loaded {} value(s) from {}", graph.values.size(), sourceName);
        return new IRText(sourceName, graph.values, graph.builder.getNodes());
    }

    private static String lineAt(String[] lines, int line) {
        return line >= 1 && line <= lines.length ? lines[line - 1] : "";
    }

    /**
     * 定义级别的语义错误，只在加载器内部使用
     */
    private static final class DefinitionError extends RuntimeException {
        DefinitionError(String message) {
            super(message);
        }
    }

    /**
     * Turns each definition into one IR node.
     */
    private static final class GraphBuilder extends LoopIRBaseVisitor<Value> {
        private final String[] lines;
        private final List<IRTextParseException.ParseError> errors;
        private final Builder builder = new Builder();
        private final TypeResolver types = new TypeResolver();
        private final LinkedHashMap<String, Value> values = new LinkedHashMap<>();
        private String currentName;

        GraphBuilder(String[] lines, List<IRTextParseException.ParseError> errors) {
            this.lines = lines;
            this.errors = errors;
        }

        void define(LoopIRParser.DefinitionContext definition) {
            String name = definition.LOCAL().getText().substring(1);
            if (values.containsKey(name)) {
                error(definition, "Redefinition of %" + name);
                return;
            }
            currentName = name;
            try {
                values.put(name, visit(definition.expr()));
            } catch (DefinitionError | CompileException | IllegalArgumentException e) {
                error(definition, e.getMessage());
            }
        }

        private void error(ParserRuleContext ctx, String message) {
            int line = ctx.getStart().getLine();
            errors.add(new IRTextParseException.ParseError(line, lineAt(lines, line), message));
        }

        private Value lookup(LoopIRParser.OperandContext operand) {
            String name = operand.LOCAL().getText().substring(1);
            Value value = values.get(name);
            if (value == null) {
                throw new DefinitionError("Undefined value %" + name);
            }
            return value;
        }

        private static int parseInt(String text) {
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new DefinitionError("Integer out of range: " + text);
            }
        }

        @Override
        public Value visitConstExpr(LoopIRParser.ConstExprContext ctx) {
            Type type = types.visit(ctx.irType());
            if (type instanceof VectorType vectorType) {
                if (!(ctx.constValue() instanceof LoopIRParser.LaneValuesContext laneValues)) {
                    throw new DefinitionError("Vector constant needs one literal per lane");
                }
                if (laneValues.constValue().size() != vectorType.getNumElements()) {
                    throw new DefinitionError("Expected " + vectorType.getNumElements()
                            + " lane(s) but got " + laneValues.constValue().size());
                }
                List<Constant> lanes = new ArrayList<>();
                for (LoopIRParser.ConstValueContext lane : laneValues.constValue()) {
                    lanes.add(scalarConstant(vectorType.getElementType(), lane));
                }
                return builder.getVector(vectorType.getElementType(), lanes);
            }
            return scalarConstant(type, ctx.constValue());
        }

        private Constant scalarConstant(Type type, LoopIRParser.ConstValueContext literal) {
            if (type instanceof IntegerType intType
                    && literal instanceof LoopIRParser.IntValueContext intValue) {
                long value;
                try {
                    value = Long.parseLong(intValue.INT().getText());
                } catch (NumberFormatException e) {
                    throw new DefinitionError("Integer out of range: " + intValue.getText());
                }
                if (intType.isI32() && (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)) {
                    throw new DefinitionError("Literal " + value + " does not fit i32");
                }
                return builder.getInt(intType, value);
            }
            if (type instanceof FloatType && (literal instanceof LoopIRParser.FloatValueContext
                    || literal instanceof LoopIRParser.IntValueContext)) {
                return builder.getFloat(Float.parseFloat(literal.getText()));
            }
            throw new DefinitionError("Literal " + literal.getText() + " is not a " + type.toNLVM());
        }

        @Override
        public Value visitArgExpr(LoopIRParser.ArgExprContext ctx) {
            return builder.buildArg(types.visit(ctx.irType()), currentName);
        }

        @Override
        public Value visitLoadExpr(LoopIRParser.LoadExprContext ctx) {
            return builder.buildLoad(lookup(ctx.operand()), currentName);
        }

        @Override
        public Value visitRangeForExpr(LoopIRParser.RangeForExprContext ctx) {
            return builder.buildRangeFor(lookup(ctx.operand(0)), lookup(ctx.operand(1)),
                    ctx.REVERSED() != null, currentName);
        }

        @Override
        public Value visitStructForExpr(LoopIRParser.StructForExprContext ctx) {
            return builder.buildStructFor(parseInt(ctx.INT().getText()), currentName);
        }

        @Override
        public Value visitOffloadedExpr(LoopIRParser.OffloadedExprContext ctx) {
            OffloadedInst.TaskType taskType = OffloadedInst.TaskType.fromName(ctx.taskType().getText());
            if (taskType == null) {
                throw new DefinitionError("Unknown task type " + ctx.taskType().getText());
            }
            return builder.buildOffloaded(taskType, parseInt(ctx.INT().getText()), currentName);
        }

        @Override
        public Value visitLoopIndexExpr(LoopIRParser.LoopIndexExprContext ctx) {
            Value loop = lookup(ctx.operand());
            if (!(loop instanceof LoopInst loopInst)) {
                throw new DefinitionError(loop.getReference() + " is not a loop");
            }
            return builder.buildLoopIndex(loopInst, parseInt(ctx.INT().getText()), currentName);
        }

        @Override
        public Value visitAssumeExpr(LoopIRParser.AssumeExprContext ctx) {
            return builder.buildRangeAssumption(lookup(ctx.operand()),
                    parseInt(ctx.INT(0).getText()), parseInt(ctx.INT(1).getText()), currentName);
        }

        @Override
        public Value visitShuffleExpr(LoopIRParser.ShuffleExprContext ctx) {
            List<VectorElement> elements = new ArrayList<>();
            for (LoopIRParser.ElementContext element : ctx.element()) {
                elements.add(new VectorElement(lookup(element.operand()), parseInt(element.INT().getText())));
            }
            return builder.buildShuffle(elements, currentName);
        }

        @Override
        public Value visitBinaryExpr(LoopIRParser.BinaryExprContext ctx) {
            Opcode opcode = Opcode.binaryFromName(ctx.IDENT().getText());
            if (opcode == null) {
                throw new DefinitionError("Unknown instruction " + ctx.IDENT().getText());
            }
            Type type = types.visit(ctx.irType());
            Value lhs = lookup(ctx.operand(0));
            Value rhs = lookup(ctx.operand(1));
            if (!lhs.getType().equals(type) || !rhs.getType().equals(type)) {
                throw new DefinitionError("Operands of " + opcode.name().toLowerCase() + " must be "
                        + type.toNLVM() + ", got " + lhs.getType() + " and " + rhs.getType());
            }
            return builder.buildBinary(opcode, lhs, rhs, currentName);
        }
    }

    private static final class TypeResolver extends LoopIRBaseVisitor<Type> {
        @Override
        public Type visitIntType(LoopIRParser.IntTypeContext ctx) {
            return IntegerType.getInteger(GraphBuilder.parseInt(ctx.INT_TYPE().getText().substring(1)));
        }

        @Override
        public Type visitFloatType(LoopIRParser.FloatTypeContext ctx) {
            return FloatType.getFloat();
        }

        @Override
        public Type visitVecType(LoopIRParser.VecTypeContext ctx) {
            return new VectorType(visit(ctx.irType()), GraphBuilder.parseInt(ctx.INT().getText()));
        }

        @Override
        public Type visitPtrType(LoopIRParser.PtrTypeContext ctx) {
            return PointerType.get(visit(ctx.irType()));
        }
    }
}
