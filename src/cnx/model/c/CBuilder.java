package cnx.model.c;

import java.util.Arrays;

public class CBuilder {
	private CBuilder() {}

	public static CVariableDeclaration declare(String type, String name, CExpression initializer) {
		return new CVariableDeclaration(type, name, initializer);
	}

	public static CExpressionStatement exprS(CExpression expression) {
		return new CExpressionStatement(expression);
	}

	public static CExpressionStatement callS(String function, CExpression... arguments) {
		return exprS(call(function, arguments));
	}

	public static CIf ifS(CExpression condition, CStatement... then) {
		return new CIf(condition, Arrays.asList(then));
	}

	public static CDoWhile doWhile(CExpression condition, CStatement... body) {
		return new CDoWhile(Arrays.asList(body), condition);
	}

	public static CBreak breakS() {
		return new CBreak();
	}

	public static CStatementHole statementHole() {
		return new CStatementHole();
	}

	public static CVariable var(String name) {
		return new CVariable(name);
	}

	public static CIntLiteral num(long value) {
		return new CIntLiteral(value);
	}

	public static CStringLiteral str(String value) {
		return new CStringLiteral(value);
	}

	public static CCall call(String function, CExpression... arguments) {
		return new CCall(function, Arrays.asList(arguments));
	}

	public static CBinop binop(String operation, CExpression lhs, CExpression rhs) {
		return new CBinop(operation, lhs, rhs);
	}

	public static CAddressOf addressOf(CExpression operand) {
		return new CAddressOf(operand);
	}

	public static CParenthesized parens(CExpression inner) {
		return new CParenthesized(inner);
	}

	public static CExpressionHole expressionHole() {
		return new CExpressionHole();
	}
}
