package cnx.trans.passes.parse;

import cnx.errors.IssueContext;
import cnx.model.program.*;
import cnx.util.SourceLocation;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

public class ProgramLoadingPass {
	private ProgramLoadingPass() {}

	public static CnxProgram perform(IssueContext ctx, Path exportPath) {
		String contents;
		try {
			contents = FileUtils.readFileToString(exportPath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.withContext(new WhileLoadingProgram(exportPath)).error(
					new ProgramLoadingIssue(SourceLocation.unknown(), "cannot read program export: " + e.getMessage()));
			return null;
		}
		return perform(ctx, exportPath, contents);
	}

	/**
	 * Reads a program export. Every malformed context, resource or function is reported, and the
	 * rest of the export is still read so that one run shows all problems.
	 *
	 * @return the program, or null if the export is not a JSON object at all
	 */
	public static CnxProgram perform(IssueContext ctx, Path exportPath, String contents) {
		IssueContext loadingCtx = ctx.withContext(new WhileLoadingProgram(exportPath));
		JSONObject root;
		try {
			root = new JSONObject(contents);
		} catch (JSONException e) {
			loadingCtx.error(new ProgramLoadingIssue(SourceLocation.unknown(), e.getMessage()));
			return null;
		}
		ProgramExportReader reader = new ProgramExportReader(exportPath);

		List<CnxContextDeclaration> contexts = new ArrayList<>();
		JSONArray contextNodes = root.optJSONArray("contexts");
		for (int i = 0; contextNodes != null && i < contextNodes.length(); i++) {
			try {
				contexts.add(reader.readContext(contextNodes.getJSONObject(i)));
			} catch (ProgramFormatException e) {
				loadingCtx.error(new ProgramLoadingIssue(e.getLocation(), e.getMessage()));
			} catch (JSONException e) {
				loadingCtx.error(new ProgramLoadingIssue(SourceLocation.unknown(), e.getMessage()));
			}
		}

		List<CnxResourceDeclaration> resources = new ArrayList<>();
		Map<String, CnxResourceDeclaration> seenResources = new HashMap<>();
		JSONArray resourceNodes = root.optJSONArray("resources");
		for (int i = 0; resourceNodes != null && i < resourceNodes.length(); i++) {
			try {
				CnxResourceDeclaration resource = reader.readResource(resourceNodes.getJSONObject(i));
				CnxResourceDeclaration previous = seenResources.putIfAbsent(resource.getName(), resource);
				if (previous != null) {
					loadingCtx.error(new DuplicateResourceIssue(resource, previous));
					continue;
				}
				resources.add(resource);
			} catch (ProgramFormatException e) {
				loadingCtx.error(new ProgramLoadingIssue(e.getLocation(), e.getMessage()));
			} catch (JSONException e) {
				loadingCtx.error(new ProgramLoadingIssue(SourceLocation.unknown(), e.getMessage()));
			}
		}

		List<CnxFunction> functions = new ArrayList<>();
		Set<String> seenFunctions = new HashSet<>();
		JSONArray functionNodes = root.optJSONArray("functions");
		for (int i = 0; functionNodes != null && i < functionNodes.length(); i++) {
			try {
				CnxFunction function = reader.readFunction(functionNodes.getJSONObject(i));
				if (!seenFunctions.add(function.getName())) {
					loadingCtx.error(new ProgramLoadingIssue(function.getLocation(),
							"function " + function.getName() + " is defined more than once"));
					continue;
				}
				functions.add(function);
			} catch (ProgramFormatException e) {
				loadingCtx.error(new ProgramLoadingIssue(e.getLocation(), e.getMessage()));
			} catch (JSONException e) {
				loadingCtx.error(new ProgramLoadingIssue(SourceLocation.unknown(), e.getMessage()));
			}
		}

		Set<String> externalFunctions = new LinkedHashSet<>();
		JSONArray externalNodes = root.optJSONArray("external_functions");
		for (int i = 0; externalNodes != null && i < externalNodes.length(); i++) {
			externalFunctions.add(externalNodes.optString(i));
		}

		return new CnxProgram(contexts, resources, functions, externalFunctions);
	}
}
