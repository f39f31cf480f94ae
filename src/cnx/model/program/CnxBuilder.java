package cnx.model.program;

import cnx.model.context.ContextKind;
import cnx.util.SourceLocation;

import java.util.*;

public class CnxBuilder {
	private CnxBuilder() {}

	public static CnxProgram program(List<CnxContextDeclaration> contexts, List<CnxResourceDeclaration> resources,
	                                 CnxFunction... functions) {
		return new CnxProgram(contexts, resources, Arrays.asList(functions), Collections.emptySet());
	}

	public static CnxProgram program(List<CnxContextDeclaration> contexts, List<CnxResourceDeclaration> resources,
	                                 Set<String> externalFunctions, CnxFunction... functions) {
		return new CnxProgram(contexts, resources, Arrays.asList(functions), externalFunctions);
	}

	public static CnxContextDeclaration mainContext(String entryFunction) {
		return new CnxContextDeclaration(SourceLocation.unknown(), "main", ContextKind.MAIN, null, entryFunction);
	}

	public static CnxContextDeclaration interrupt(String name, Integer priority, String entryFunction) {
		return new CnxContextDeclaration(SourceLocation.unknown(), name, ContextKind.INTERRUPT, priority, entryFunction);
	}

	public static CnxResourceDeclaration atomic(String name, CnxType type) {
		return new CnxResourceDeclaration(SourceLocation.unknown(), name, ResourceKind.ATOMIC, type);
	}

	public static CnxResourceDeclaration shared(String name, CnxType type) {
		return new CnxResourceDeclaration(SourceLocation.unknown(), name, ResourceKind.REGION_SCOPED, type);
	}

	public static CnxFunction function(String name, CnxStatement... body) {
		return new CnxFunction(SourceLocation.unknown(), name, Collections.emptyList(), false, Arrays.asList(body));
	}

	public static CnxFunction function(String name, List<String> locals, CnxStatement... body) {
		return new CnxFunction(SourceLocation.unknown(), name, locals, false, Arrays.asList(body));
	}

	public static CnxFunction callback(String name, CnxStatement... body) {
		return new CnxFunction(SourceLocation.unknown(), name, Collections.emptyList(), true, Arrays.asList(body));
	}

	public static CnxAssignment assign(String target, CnxExpression value) {
		return new CnxAssignment(SourceLocation.unknown(), target, AssignmentOperator.ASSIGN, value);
	}

	public static CnxAssignment assign(String target, String operator, CnxExpression value) {
		return new CnxAssignment(SourceLocation.unknown(), target, AssignmentOperator.fromSymbol(operator), value);
	}

	public static CnxExpressionStatement exprS(CnxExpression expression) {
		return new CnxExpressionStatement(SourceLocation.unknown(), expression);
	}

	public static CnxExpressionStatement callS(String callee, CnxExpression... args) {
		return exprS(call(callee, args));
	}

	public static CnxLocalDeclaration local(String name, CnxExpression initializer) {
		return new CnxLocalDeclaration(SourceLocation.unknown(), name, initializer);
	}

	public static CnxCriticalBlock critical(CnxStatement... body) {
		return new CnxCriticalBlock(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static CnxBlock block(CnxStatement... body) {
		return new CnxBlock(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static CnxIf ifS(CnxExpression condition, List<CnxStatement> yes, List<CnxStatement> no) {
		return new CnxIf(SourceLocation.unknown(), condition, yes, no);
	}

	public static CnxWhile whileS(CnxExpression condition, CnxStatement... body) {
		return new CnxWhile(SourceLocation.unknown(), condition, Arrays.asList(body));
	}

	public static CnxDoWhile doWhile(CnxExpression condition, CnxStatement... body) {
		return new CnxDoWhile(SourceLocation.unknown(), Arrays.asList(body), condition);
	}

	public static CnxFor forS(CnxStatement init, CnxExpression condition, CnxStatement update, CnxStatement... body) {
		return new CnxFor(SourceLocation.unknown(), init, condition, update, Arrays.asList(body));
	}

	public static CnxReturn returnS() {
		return new CnxReturn(SourceLocation.unknown(), null);
	}

	public static CnxReturn returnS(CnxExpression value) {
		return new CnxReturn(SourceLocation.unknown(), value);
	}

	public static CnxBreak breakS() {
		return new CnxBreak(SourceLocation.unknown());
	}

	public static CnxContinue continueS() {
		return new CnxContinue(SourceLocation.unknown());
	}

	public static CnxVariableReference idexp(String name) {
		return new CnxVariableReference(SourceLocation.unknown(), name);
	}

	public static CnxLiteral num(long value) {
		return new CnxLiteral(SourceLocation.unknown(), Long.toString(value));
	}

	public static CnxLiteral bool(boolean value) {
		return new CnxLiteral(SourceLocation.unknown(), value ? "true" : "false");
	}

	public static CnxBinop binop(String operation, CnxExpression lhs, CnxExpression rhs) {
		return new CnxBinop(SourceLocation.unknown(), operation, lhs, rhs);
	}

	public static CnxUnop unop(String operation, CnxExpression operand) {
		return new CnxUnop(SourceLocation.unknown(), operation, operand);
	}

	public static CnxCall call(String callee, CnxExpression... args) {
		return new CnxCall(SourceLocation.unknown(), callee, Arrays.asList(args));
	}

	public static CnxIndirectCall indirectCall(CnxExpression target, CnxExpression... args) {
		return new CnxIndirectCall(SourceLocation.unknown(), target, Arrays.asList(args));
	}
}
