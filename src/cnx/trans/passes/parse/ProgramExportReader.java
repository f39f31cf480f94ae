package cnx.trans.passes.parse;

import cnx.model.context.ContextKind;
import cnx.model.program.*;
import cnx.util.SourceLocation;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns the JSON nodes of the front-end's program export into program model nodes.
 */
public class ProgramExportReader {
	private final Path exportPath;

	public ProgramExportReader(Path exportPath) {
		this.exportPath = exportPath;
	}

	SourceLocation locationOf(JSONObject node) {
		if (!node.has("line")) {
			return SourceLocation.unknown();
		}
		return new SourceLocation(exportPath, node.getInt("line"), node.optInt("column", -1));
	}

	private String requireString(JSONObject node, String key) throws ProgramFormatException {
		try {
			return node.getString(key);
		} catch (JSONException e) {
			throw new ProgramFormatException(locationOf(node), e.getMessage());
		}
	}

	private JSONArray optArray(JSONObject node, String key) throws ProgramFormatException {
		if (!node.has(key)) {
			return new JSONArray();
		}
		try {
			return node.getJSONArray(key);
		} catch (JSONException e) {
			throw new ProgramFormatException(locationOf(node), e.getMessage());
		}
	}

	private JSONObject getObject(JSONArray array, int index, SourceLocation parent) throws ProgramFormatException {
		try {
			return array.getJSONObject(index);
		} catch (JSONException e) {
			throw new ProgramFormatException(parent, e.getMessage());
		}
	}

	public CnxContextDeclaration readContext(JSONObject node) throws ProgramFormatException {
		SourceLocation location = locationOf(node);
		String name = requireString(node, "name");
		String kindName = node.optString("kind", "interrupt");
		ContextKind kind;
		switch (kindName) {
			case "main":
				kind = ContextKind.MAIN;
				break;
			case "interrupt":
				kind = ContextKind.INTERRUPT;
				break;
			default:
				throw new ProgramFormatException(location, "unknown context kind \"" + kindName + "\"");
		}
		Integer priority = null;
		if (node.has("priority")) {
			try {
				priority = node.getInt("priority");
			} catch (JSONException e) {
				throw new ProgramFormatException(location, e.getMessage());
			}
			if (priority < 0) {
				throw new ProgramFormatException(location,
						"context " + name + " has negative priority " + priority);
			}
		}
		String entry = node.optString("entry", kind == ContextKind.MAIN ? "main" : name);
		return new CnxContextDeclaration(location, name, kind, priority, entry);
	}

	public CnxResourceDeclaration readResource(JSONObject node) throws ProgramFormatException {
		SourceLocation location = locationOf(node);
		String name = requireString(node, "name");
		String kindName = node.optString("kind", "region_scoped");
		ResourceKind kind;
		switch (kindName) {
			case "atomic":
				kind = ResourceKind.ATOMIC;
				break;
			case "region_scoped":
				kind = ResourceKind.REGION_SCOPED;
				break;
			default:
				throw new ProgramFormatException(location, "unknown resource kind \"" + kindName + "\"");
		}
		String typeName = node.optString("type", "u32");
		Optional<CnxType> type = CnxType.fromName(typeName);
		if (!type.isPresent()) {
			throw new ProgramFormatException(location, "unsupported type \"" + typeName + "\" for resource " + name);
		}
		return new CnxResourceDeclaration(location, name, kind, type.get());
	}

	public CnxFunction readFunction(JSONObject node) throws ProgramFormatException {
		SourceLocation location = locationOf(node);
		String name = requireString(node, "name");
		List<String> locals = new ArrayList<>();
		for (String key : new String[]{"params", "locals"}) {
			JSONArray names = optArray(node, key);
			for (int i = 0; i < names.length(); i++) {
				locals.add(names.optString(i));
			}
		}
		boolean addressTaken = node.optBoolean("address_taken", false);
		return new CnxFunction(location, name, locals, addressTaken, readStatements(node, "body"));
	}

	private List<CnxStatement> readStatements(JSONObject parent, String key) throws ProgramFormatException {
		JSONArray array = optArray(parent, key);
		List<CnxStatement> statements = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			statements.add(readStatement(getObject(array, i, locationOf(parent))));
		}
		return statements;
	}

	private CnxStatement readOptionalStatement(JSONObject parent, String key) throws ProgramFormatException {
		JSONObject node = parent.optJSONObject(key);
		return node == null ? null : readStatement(node);
	}

	private CnxExpression readOptionalExpression(JSONObject parent, String key) throws ProgramFormatException {
		JSONObject node = parent.optJSONObject(key);
		return node == null ? null : readExpression(node);
	}

	private CnxExpression readRequiredExpression(JSONObject parent, String key) throws ProgramFormatException {
		JSONObject node = parent.optJSONObject(key);
		if (node == null) {
			throw new ProgramFormatException(locationOf(parent), "missing expression \"" + key + "\"");
		}
		return readExpression(node);
	}

	public CnxStatement readStatement(JSONObject node) throws ProgramFormatException {
		SourceLocation location = locationOf(node);
		String kind = requireString(node, "kind");
		switch (kind) {
			case "assign": {
				AssignmentOperator operator;
				try {
					operator = AssignmentOperator.fromSymbol(node.optString("op", "<-"));
				} catch (IllegalArgumentException e) {
					throw new ProgramFormatException(location, e.getMessage());
				}
				return new CnxAssignment(location, requireString(node, "target"), operator,
						readRequiredExpression(node, "value"));
			}
			case "expr":
				return new CnxExpressionStatement(location, readRequiredExpression(node, "expr"));
			case "local":
				return new CnxLocalDeclaration(location, requireString(node, "name"), readOptionalExpression(node, "init"));
			case "critical":
				return new CnxCriticalBlock(location, readStatements(node, "body"));
			case "block":
				return new CnxBlock(location, readStatements(node, "body"));
			case "if":
				return new CnxIf(location, readRequiredExpression(node, "cond"), readStatements(node, "then"),
						readStatements(node, "else"));
			case "while":
				return new CnxWhile(location, readRequiredExpression(node, "cond"), readStatements(node, "body"));
			case "do_while":
				return new CnxDoWhile(location, readStatements(node, "body"), readRequiredExpression(node, "cond"));
			case "for":
				return new CnxFor(location, readOptionalStatement(node, "init"), readOptionalExpression(node, "cond"),
						readOptionalStatement(node, "update"), readStatements(node, "body"));
			case "return":
				return new CnxReturn(location, readOptionalExpression(node, "value"));
			case "break":
				return new CnxBreak(location);
			case "continue":
				return new CnxContinue(location);
			default:
				throw new ProgramFormatException(location, "unknown statement kind \"" + kind + "\"");
		}
	}

	private List<CnxExpression> readArguments(JSONObject node) throws ProgramFormatException {
		JSONArray array = optArray(node, "args");
		if (array.length() == 0) {
			return Collections.emptyList();
		}
		List<CnxExpression> arguments = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			arguments.add(readExpression(getObject(array, i, locationOf(node))));
		}
		return arguments;
	}

	public CnxExpression readExpression(JSONObject node) throws ProgramFormatException {
		SourceLocation location = locationOf(node);
		String kind = requireString(node, "kind");
		switch (kind) {
			case "ref":
				return new CnxVariableReference(location, requireString(node, "name"));
			case "literal":
				return new CnxLiteral(location, node.has("value") ? String.valueOf(node.get("value")) : "0");
			case "binop":
				return new CnxBinop(location, requireString(node, "op"), readRequiredExpression(node, "lhs"),
						readRequiredExpression(node, "rhs"));
			case "unop":
				return new CnxUnop(location, requireString(node, "op"), readRequiredExpression(node, "operand"));
			case "call":
				return new CnxCall(location, requireString(node, "callee"), readArguments(node));
			case "indirect_call":
				return new CnxIndirectCall(location, readRequiredExpression(node, "target"), readArguments(node));
			default:
				throw new ProgramFormatException(location, "unknown expression kind \"" + kind + "\"");
		}
	}
}
