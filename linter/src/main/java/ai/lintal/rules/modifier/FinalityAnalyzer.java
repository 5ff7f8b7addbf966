package ai.lintal.rules.modifier;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.diagnostics.Diagnostic;
import ai.lintal.rules.CheckContext;
import ai.lintal.treesitter.CstTraversalUtils;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Single-use walker that decides, for every local declared in one executable body, whether it is given a value at
 * most once on every path. Nested lambdas and class bodies are analyzed in the same walk.
 *
 * <p>The walk keeps a stack of scopes, the current per-candidate state, whether the current point is reachable, and
 * the statements that {@code break}/{@code yield} may leave. Branches snapshot the state before they split and merge
 * the completing alternatives point-wise.
 */
final class FinalityAnalyzer {
    private static final Logger logger = LogManager.getLogger(FinalityAnalyzer.class);

    private static final String UNNAMED = "_";

    private final CheckContext ctx;
    private final boolean validateEnhancedForLoopVariable;
    private final boolean validateUnnamedVariables;

    private final Deque<Scope> scopes = new ArrayDeque<>();
    private Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int loopDepth = 0;
    private boolean reachable = true;

    FinalityAnalyzer(CheckContext ctx, boolean validateEnhancedForLoopVariable, boolean validateUnnamedVariables) {
        this.ctx = ctx;
        this.validateEnhancedForLoopVariable = validateEnhancedForLoopVariable;
        this.validateUnnamedVariables = validateUnnamedVariables;
    }

    /** Analyzes one entry point and returns a diagnostic for every local that should be final. */
    List<Diagnostic> analyze(CstNode entry) {
        switch (entry.kind()) {
            case METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, COMPACT_CONSTRUCTOR_DECLARATION ->
                visitExecutableMember(entry);
            case LAMBDA_EXPRESSION -> visitLambda(entry);
            default -> {
                pushScope();
                visit(entry);
                popScope();
            }
        }
        return diagnostics;
    }

    // ---------------------------------------------------------------------------------------------
    // dispatch

    private void visit(CstNode node) {
        switch (node.kind()) {
            case BLOCK, CONSTRUCTOR_BODY -> visitBlock(node);
            case LOCAL_VARIABLE_DECLARATION -> visitLocalVariableDeclaration(node, false);
            case ASSIGNMENT_EXPRESSION -> visitAssignment(node);
            case UPDATE_EXPRESSION -> visitUpdate(node);
            case IF_STATEMENT -> visitIf(node);
            case TERNARY_EXPRESSION -> visitTernary(node);
            case BINARY_EXPRESSION -> visitBinary(node);
            case WHILE_STATEMENT -> visitWhile(node);
            case DO_STATEMENT -> visitDo(node);
            case FOR_STATEMENT -> visitFor(node);
            case ENHANCED_FOR_STATEMENT -> visitEnhancedFor(node);
            case SWITCH_EXPRESSION -> visitSwitch(node);
            case TRY_STATEMENT, TRY_WITH_RESOURCES_STATEMENT -> visitTry(node);
            case LABELED_STATEMENT -> visitLabeled(node);
            case BREAK_STATEMENT -> visitBreak(node);
            case YIELD_STATEMENT -> visitYield(node);
            case CONTINUE_STATEMENT -> visitContinue(node);
            case RETURN_STATEMENT, THROW_STATEMENT -> {
                visitChildren(node);
                reachable = false;
            }
            case LAMBDA_EXPRESSION -> visitLambda(node);
            case CLASS_BODY, INTERFACE_BODY, ENUM_BODY, ANNOTATION_TYPE_BODY -> visitNestedTypeBody(node);
            case METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, COMPACT_CONSTRUCTOR_DECLARATION ->
                visitExecutableMember(node);
            case FIELD_DECLARATION, CONSTANT_DECLARATION -> visitFieldInitializers(node);
            case INSTANCEOF_EXPRESSION -> {
                visitChildren(node);
                node.childByFieldName(FIELD_NAME).ifPresent(this::declareExcluded);
            }
            case TYPE_PATTERN, RECORD_PATTERN_COMPONENT -> {
                visitChildren(node);
                node.childrenOfKind(IDENTIFIER).forEach(this::declareExcluded);
            }
            case LINE_COMMENT, BLOCK_COMMENT -> {}
            default -> visitChildren(node);
        }
    }

    private void visitChildren(CstNode node) {
        for (var child : node.children()) {
            if (child.isNamed()) {
                visit(child);
            }
        }
    }

    private void visitBlock(CstNode block) {
        pushScope();
        visitChildren(block);
        popScope();
    }

    // ---------------------------------------------------------------------------------------------
    // declarations and assignments

    private void visitLocalVariableDeclaration(CstNode declaration, boolean forInit) {
        boolean isFinal = CstTraversalUtils.hasFinalModifier(declaration);
        for (var declarator : declaration.childrenOfKind(VARIABLE_DECLARATOR)) {
            var value = declarator.childByFieldName(FIELD_VALUE);
            value.ifPresent(this::visit);
            var nameNode = declarator.childByFieldName(FIELD_NAME);
            if (nameNode.isEmpty()) {
                logger.debug("Declarator without a name at byte {} of {}", declarator.startByte(), ctx.fileName());
                continue;
            }
            var name = nameNode.get();
            if (isUnnamed(name) && !validateUnnamedVariables) {
                continue;
            }
            if (isFinal || forInit) {
                declareExcluded(name);
            } else {
                declare(VariableCandidate.tracked(ctx.text(name), name.range(), loopDepth, value.isPresent()));
            }
        }
    }

    private void visitFieldInitializers(CstNode declaration) {
        for (var declarator : declaration.childrenOfKind(VARIABLE_DECLARATOR)) {
            declarator.childByFieldName(FIELD_VALUE).ifPresent(this::visit);
        }
    }

    private void visitAssignment(CstNode assignment) {
        var left = assignment.childByFieldName(FIELD_LEFT);
        var target = left.map(CstTraversalUtils::unwrapParentheses)
                .filter(n -> n.is(IDENTIFIER))
                .orElse(null);
        if (target == null) {
            left.ifPresent(this::visit);
        }
        assignment.childByFieldName(FIELD_RIGHT).ifPresent(this::visit);
        if (target != null) {
            recordAssignment(ctx.text(target));
        }
    }

    private void visitUpdate(CstNode update) {
        var operand = update.namedChildren().stream()
                .filter(n -> !isComment(n.kind()))
                .findFirst();
        if (operand.isEmpty()) {
            return;
        }
        var target = CstTraversalUtils.unwrapParentheses(operand.get());
        if (target.is(IDENTIFIER)) {
            recordAssignment(ctx.text(target));
        } else {
            visit(operand.get());
        }
    }

    private void recordAssignment(String name) {
        var candidate = lookup(name);
        if (candidate != null) {
            candidate.assign(loopDepth);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // branches

    private void visitIf(CstNode ifStatement) {
        ifStatement.childByFieldName(FIELD_CONDITION).ifPresent(this::visit);
        var entry = snapshot();
        ifStatement.childByFieldName(FIELD_CONSEQUENCE).ifPresent(this::visit);
        var thenExit = snapshot();
        restore(entry);
        ifStatement.childByFieldName(FIELD_ALTERNATIVE).ifPresent(this::visit);
        merge(List.of(thenExit, snapshot()));
    }

    private void visitTernary(CstNode ternary) {
        ternary.childByFieldName(FIELD_CONDITION).ifPresent(this::visit);
        var entry = snapshot();
        ternary.childByFieldName(FIELD_CONSEQUENCE).ifPresent(this::visit);
        var first = snapshot();
        restore(entry);
        ternary.childByFieldName(FIELD_ALTERNATIVE).ifPresent(this::visit);
        merge(List.of(first, snapshot()));
    }

    /**
     * Left-nested chains such as long string concatenations are walked in a loop, innermost operator first, so their
     * length does not grow the call stack.
     */
    private void visitBinary(CstNode binary) {
        var chain = new ArrayDeque<CstNode>();
        CstNode leftmost = binary;
        while (leftmost.is(BINARY_EXPRESSION)) {
            chain.push(leftmost);
            var left = leftmost.childByFieldName(FIELD_LEFT);
            if (left.isEmpty()) {
                break;
            }
            leftmost = left.get();
        }
        if (!leftmost.is(BINARY_EXPRESSION)) {
            visit(leftmost);
        }
        for (var operation : chain) {
            var operator = operation.childByFieldName(FIELD_OPERATOR).map(ctx::text).orElse("");
            var right = operation.childByFieldName(FIELD_RIGHT);
            if (operator.equals("&&") || operator.equals("||")) {
                var shortCircuit = snapshot();
                right.ifPresent(this::visit);
                merge(List.of(shortCircuit, snapshot()));
            } else {
                right.ifPresent(this::visit);
            }
        }
    }

    private void visitSwitch(CstNode switchNode) {
        switchNode.childByFieldName(FIELD_CONDITION).ifPresent(this::visit);
        var body = switchNode.childByFieldName(FIELD_BODY);
        if (body.isEmpty()) {
            return;
        }
        var target = pushJumpTarget(JumpTarget.Kind.SWITCH);
        pushScope();
        var entry = snapshot();
        var outcomes = new ArrayList<FlowSnapshot>();
        boolean hasDefault = false;
        boolean sawGroup = false;
        boolean fallsThrough = false;
        for (var arm : body.get().namedChildren()) {
            if (arm.is(SWITCH_RULE)) {
                hasDefault |= hasDefaultLabel(arm);
                restore(entry);
                visitChildren(arm);
                outcomes.add(snapshot());
            } else if (arm.is(SWITCH_BLOCK_STATEMENT_GROUP)) {
                hasDefault |= hasDefaultLabel(arm);
                if (!fallsThrough) {
                    restore(entry);
                }
                visitChildren(arm);
                fallsThrough = reachable;
                sawGroup = true;
            }
        }
        if (sawGroup) {
            outcomes.add(snapshot());
        }
        if (!hasDefault) {
            outcomes.add(entry);
        }
        popJumpTarget();
        outcomes.addAll(target.exits());
        merge(outcomes);
        popScope();
    }

    private static boolean hasDefaultLabel(CstNode arm) {
        for (var label : arm.childrenOfKind(SWITCH_LABEL)) {
            if (label.firstChildOfKind("default").isPresent()) {
                return true;
            }
        }
        return false;
    }

    private void visitTry(CstNode tryNode) {
        boolean reachableAtEntry = reachable;
        pushScope();
        tryNode.childByFieldName(FIELD_RESOURCES).ifPresent(this::visitResources);
        tryNode.childByFieldName(FIELD_BODY).ifPresent(this::visit);
        var tryExit = snapshot();
        var outcomes = new ArrayList<FlowSnapshot>();
        outcomes.add(tryExit);
        for (var catchClause : tryNode.childrenOfKind(CATCH_CLAUSE)) {
            restore(new FlowSnapshot(tryExit.states(), reachableAtEntry));
            pushScope();
            catchClause
                    .firstChildOfKind(CATCH_FORMAL_PARAMETER)
                    .flatMap(p -> p.childByFieldName(FIELD_NAME))
                    .ifPresent(this::declareExcluded);
            catchClause.childByFieldName(FIELD_BODY).ifPresent(this::visit);
            popScope();
            outcomes.add(snapshot());
        }
        merge(outcomes);
        tryNode.firstChildOfKind(FINALLY_CLAUSE).ifPresent(this::visitChildren);
        popScope();
    }

    private void visitResources(CstNode specification) {
        for (var resource : specification.childrenOfKind(RESOURCE)) {
            var value = resource.childByFieldName(FIELD_VALUE);
            if (value.isEmpty()) {
                // reference to an existing effectively final variable
                visitChildren(resource);
                continue;
            }
            visit(value.get());
            resource.childByFieldName(FIELD_NAME).ifPresent(this::declareExcluded);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // loops and jumps

    private void visitWhile(CstNode loop) {
        var condition = loop.childByFieldName(FIELD_CONDITION);
        var target = pushJumpTarget(JumpTarget.Kind.LOOP);
        var entry = snapshot();
        loopDepth++;
        condition.ifPresent(this::visit);
        loop.childByFieldName(FIELD_BODY).ifPresent(this::visit);
        loopDepth--;
        var bodyExit = snapshot();
        popJumpTarget();
        exitLoop(isConstantTrue(condition), List.of(entry, bodyExit), target);
    }

    private void visitDo(CstNode loop) {
        var condition = loop.childByFieldName(FIELD_CONDITION);
        var target = pushJumpTarget(JumpTarget.Kind.LOOP);
        loopDepth++;
        loop.childByFieldName(FIELD_BODY).ifPresent(this::visit);
        joinContinues(target);
        condition.ifPresent(this::visit);
        loopDepth--;
        var bodyExit = snapshot();
        popJumpTarget();
        exitLoop(isConstantTrue(condition), List.of(bodyExit), target);
    }

    private void visitFor(CstNode loop) {
        pushScope();
        var body = loop.childByFieldName(FIELD_BODY).orElse(null);
        var condition = loop.childByFieldName(FIELD_CONDITION);
        var updates = new ArrayList<CstNode>();
        int section = 0;
        for (var child : loop.children()) {
            if (body != null && child.equals(body)) {
                break;
            }
            if (child.is(";")) {
                section++;
            } else if (child.is(LOCAL_VARIABLE_DECLARATION)) {
                visitLocalVariableDeclaration(child, true);
                section = 1;
            } else if (child.isNamed() && !isComment(child.kind())) {
                if (section == 0) {
                    visit(child);
                } else if (section == 2) {
                    updates.add(child);
                }
            }
        }
        var target = pushJumpTarget(JumpTarget.Kind.LOOP);
        var entry = snapshot();
        loopDepth++;
        condition.ifPresent(this::visit);
        if (body != null) {
            visit(body);
        }
        joinContinues(target);
        updates.forEach(this::visit);
        loopDepth--;
        var bodyExit = snapshot();
        popJumpTarget();
        exitLoop(condition.isEmpty() || isConstantTrue(condition), List.of(entry, bodyExit), target);
        popScope();
    }

    private void visitEnhancedFor(CstNode loop) {
        loop.childByFieldName(FIELD_VALUE).ifPresent(this::visit);
        var target = pushJumpTarget(JumpTarget.Kind.LOOP);
        var entry = snapshot();
        pushScope();
        loopDepth++;
        var nameNode = loop.childByFieldName(FIELD_NAME);
        if (nameNode.isPresent()) {
            var name = nameNode.get();
            boolean skip = isUnnamed(name) && !validateUnnamedVariables;
            if (!skip) {
                if (validateEnhancedForLoopVariable && !CstTraversalUtils.hasFinalModifier(loop)) {
                    declare(VariableCandidate.tracked(ctx.text(name), name.range(), loopDepth, true));
                } else {
                    declareExcluded(name);
                }
            }
        }
        loop.childByFieldName(FIELD_BODY).ifPresent(this::visit);
        loopDepth--;
        var bodyExit = snapshot();
        popJumpTarget();
        exitLoop(false, List.of(entry, bodyExit), target);
        popScope();
    }

    /**
     * Sets the state after a loop: the normal exits (unless the loop condition can never be false) merged with every
     * {@code break} that left the loop.
     */
    private void exitLoop(boolean infinite, List<FlowSnapshot> normalExits, JumpTarget target) {
        var outcomes = new ArrayList<FlowSnapshot>();
        for (var exit : normalExits) {
            outcomes.add(infinite ? new FlowSnapshot(exit.states(), false) : exit);
        }
        outcomes.addAll(target.exits());
        merge(outcomes);
    }

    private void visitLabeled(CstNode labeled) {
        var label = labeled.firstChildOfKind(IDENTIFIER).map(ctx::text).orElse(null);
        var target = new JumpTarget(JumpTarget.Kind.LABELED, label);
        jumpTargets.push(target);
        for (var child : labeled.namedChildren()) {
            if (!child.is(IDENTIFIER)) {
                visit(child);
            }
        }
        jumpTargets.pop();
        if (!target.exits().isEmpty()) {
            var outcomes = new ArrayList<FlowSnapshot>();
            outcomes.add(snapshot());
            outcomes.addAll(target.exits());
            merge(outcomes);
        }
    }

    private void visitContinue(CstNode continueStatement) {
        var label = continueStatement.firstChildOfKind(IDENTIFIER).map(ctx::text);
        findContinueTarget(label).ifPresent(t -> t.addContinue(snapshot()));
        reachable = false;
    }

    /** The state at the end of a loop body also flows in from every {@code continue} of that iteration. */
    private void joinContinues(JumpTarget loop) {
        if (loop.continues().isEmpty()) {
            return;
        }
        var outcomes = new ArrayList<FlowSnapshot>();
        outcomes.add(snapshot());
        outcomes.addAll(loop.continues());
        merge(outcomes);
    }

    private void visitBreak(CstNode breakStatement) {
        var label = breakStatement.firstChildOfKind(IDENTIFIER).map(ctx::text);
        findJumpTarget(label).ifPresent(t -> t.addExit(snapshot()));
        reachable = false;
    }

    private void visitYield(CstNode yieldStatement) {
        visitChildren(yieldStatement);
        for (var target : jumpTargets) {
            if (target.kind() == JumpTarget.Kind.SWITCH) {
                target.addExit(snapshot());
                break;
            }
        }
        reachable = false;
    }

    private Optional<JumpTarget> findJumpTarget(Optional<String> label) {
        for (var target : jumpTargets) {
            if (label.isPresent()) {
                if (target.kind() == JumpTarget.Kind.LABELED && label.get().equals(target.label())) {
                    return Optional.of(target);
                }
            } else if (target.kind() != JumpTarget.Kind.LABELED) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    /** Innermost loop, or with a label the loop directly inside the matching labeled statement. */
    private Optional<JumpTarget> findContinueTarget(Optional<String> label) {
        @Nullable JumpTarget innermostLoop = null;
        for (var target : jumpTargets) {
            if (target.kind() == JumpTarget.Kind.LOOP) {
                if (label.isEmpty()) {
                    return Optional.of(target);
                }
                innermostLoop = target;
            } else if (target.kind() == JumpTarget.Kind.LABELED
                    && label.isPresent()
                    && label.get().equals(target.label())) {
                return Optional.ofNullable(innermostLoop);
            }
        }
        return Optional.empty();
    }

    private JumpTarget pushJumpTarget(JumpTarget.Kind kind) {
        var target = new JumpTarget(kind, null);
        jumpTargets.push(target);
        return target;
    }

    private void popJumpTarget() {
        jumpTargets.pop();
    }

    private boolean isConstantTrue(Optional<CstNode> condition) {
        return condition
                .map(CstTraversalUtils::unwrapParentheses)
                .map(n -> n.is(TRUE))
                .orElse(false);
    }

    // ---------------------------------------------------------------------------------------------
    // deferred regions: members, lambdas and nested classes

    private void visitExecutableMember(CstNode member) {
        var saved = snapshot();
        reachable = true;
        pushScope();
        member.childByFieldName(FIELD_PARAMETERS).ifPresent(this::declareParameters);
        member.childByFieldName(FIELD_BODY).ifPresent(this::visit);
        popScope();
        restore(saved);
    }

    private void visitLambda(CstNode lambda) {
        enterRepeatingRegion(() -> {
            pushScope();
            lambda.childByFieldName(FIELD_PARAMETERS).ifPresent(params -> {
                if (params.is(IDENTIFIER)) {
                    declareExcluded(params);
                } else {
                    declareParameters(params);
                }
            });
            lambda.childByFieldName(FIELD_BODY).ifPresent(this::visit);
            popScope();
        });
    }

    private void visitNestedTypeBody(CstNode body) {
        enterRepeatingRegion(() -> {
            pushScope();
            declareMembers(body);
            body.parent()
                    .filter(p -> p.is(RECORD_DECLARATION))
                    .flatMap(p -> p.childByFieldName(FIELD_PARAMETERS))
                    .ifPresent(this::declareParameters);
            visitChildren(body);
            popScope();
        });
    }

    /** Registers fields and enum constants so they shadow same-named locals of the enclosing body. */
    private void declareMembers(CstNode body) {
        for (var member : body.namedChildren()) {
            switch (member.kind()) {
                case FIELD_DECLARATION, CONSTANT_DECLARATION -> member.childrenOfKind(VARIABLE_DECLARATOR)
                        .forEach(d -> d.childByFieldName(FIELD_NAME).ifPresent(this::declareExcluded));
                case ENUM_CONSTANT -> member.childByFieldName(FIELD_NAME).ifPresent(this::declareExcluded);
                case ENUM_BODY_DECLARATIONS -> declareMembers(member);
                default -> {}
            }
        }
    }

    private void enterRepeatingRegion(Runnable region) {
        var saved = snapshot();
        var savedTargets = jumpTargets;
        jumpTargets = new ArrayDeque<>();
        loopDepth++;
        reachable = true;
        region.run();
        loopDepth--;
        jumpTargets = savedTargets;
        restore(saved);
    }

    private void declareParameters(CstNode parameters) {
        for (var parameter : parameters.namedChildren()) {
            switch (parameter.kind()) {
                case FORMAL_PARAMETER -> parameter.childByFieldName(FIELD_NAME).ifPresent(this::declareExcluded);
                case SPREAD_PARAMETER -> parameter
                        .firstChildOfKind(VARIABLE_DECLARATOR)
                        .flatMap(d -> d.childByFieldName(FIELD_NAME))
                        .ifPresent(this::declareExcluded);
                case IDENTIFIER -> declareExcluded(parameter);
                default -> {}
            }
        }
    }

    // ---------------------------------------------------------------------------------------------
    // scopes and flow state

    private void declare(VariableCandidate candidate) {
        var scope = scopes.peek();
        if (scope == null) {
            logger.debug("No open scope for {}", candidate.name());
            return;
        }
        scope.declare(candidate);
    }

    private void declareExcluded(CstNode nameNode) {
        if (isUnnamed(nameNode)) {
            return;
        }
        declare(VariableCandidate.excluded(ctx.text(nameNode), nameNode.range(), loopDepth));
    }

    private boolean isUnnamed(CstNode nameNode) {
        return nameNode.is(UNDERSCORE_PATTERN) || UNNAMED.equals(ctx.text(nameNode));
    }

    @Nullable
    private VariableCandidate lookup(String name) {
        for (var scope : scopes) {
            var candidate = scope.find(name);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private void pushScope() {
        scopes.push(new Scope());
    }

    private void popScope() {
        var scope = scopes.pop();
        for (var candidate : scope.candidates()) {
            if (candidate.shouldBeFinal()) {
                diagnostics.add(new Diagnostic(
                        new FinalLocalVariable.VariableShouldBeFinal(candidate.name()), candidate.nameRange()));
            }
        }
    }

    private FlowSnapshot snapshot() {
        var states = new IdentityHashMap<VariableCandidate, CandidateState>();
        for (var scope : scopes) {
            for (var candidate : scope.candidates()) {
                states.put(candidate, candidate.state());
            }
        }
        return new FlowSnapshot(states, reachable);
    }

    private void restore(FlowSnapshot snapshot) {
        for (var scope : scopes) {
            for (var candidate : scope.candidates()) {
                candidate.resetState(snapshot.stateOf(candidate));
            }
        }
        reachable = snapshot.reachable();
    }

    /**
     * Joins alternative paths. Only alternatives that reach the join contribute; if none does, the join is
     * unreachable and all of them are combined so later code still sees a plausible state.
     */
    private void merge(List<FlowSnapshot> outcomes) {
        var live = outcomes.stream().filter(FlowSnapshot::reachable).toList();
        var contributing = live.isEmpty() ? outcomes : live;
        for (var scope : scopes) {
            for (var candidate : scope.candidates()) {
                var merged = CandidateState.UNTOUCHED;
                for (var outcome : contributing) {
                    merged = CandidateState.worse(merged, outcome.stateOf(candidate));
                }
                candidate.resetState(merged);
            }
        }
        reachable = !live.isEmpty();
    }
}
