package cnx;

import cnx.trans.passes.ceiling.OpaqueCallPolicy;
import cnx.trans.passes.codegen.TargetCapabilities;
import cnx.trans.passes.reachability.UnresolvedCallPolicy;
import org.json.JSONException;
import org.json.JSONObject;

// Settings of one analysis run, read from the "target", "unresolved_calls", "opaque_calls",
// "debug_guards" and "output" fields of the JSON configuration file. Every field is optional.
// Values are fixed once read and passed explicitly to the passes that need them.
public final class CnxAnalysisOptions {
	public static final String TARGET_FIELD = "target";
	public static final String UNRESOLVED_CALLS_FIELD = "unresolved_calls";
	public static final String OPAQUE_CALLS_FIELD = "opaque_calls";
	public static final String DEBUG_GUARDS_FIELD = "debug_guards";
	public static final String OUTPUT_FIELD = "output";

	public static final String DEFAULT_OUTPUT = "critical.json";

	private final TargetCapabilities target;
	private final UnresolvedCallPolicy unresolvedCallPolicy;
	private final OpaqueCallPolicy opaqueCallPolicy;
	private final boolean debugGuards;
	private final String output;

	public CnxAnalysisOptions(TargetCapabilities target, UnresolvedCallPolicy unresolvedCallPolicy,
	                          OpaqueCallPolicy opaqueCallPolicy, boolean debugGuards, String output) {
		this.target = target;
		this.unresolvedCallPolicy = unresolvedCallPolicy;
		this.opaqueCallPolicy = opaqueCallPolicy;
		this.debugGuards = debugGuards;
		this.output = output;
	}

	public static CnxAnalysisOptions defaults() {
		return new CnxAnalysisOptions(TargetCapabilities.DEFAULT, UnresolvedCallPolicy.REJECT,
				OpaqueCallPolicy.CONSERVATIVE, false, DEFAULT_OUTPUT);
	}

	public static CnxAnalysisOptions fromJSON(JSONObject config) throws CnxOptionException {
		try {
			TargetCapabilities target = TargetCapabilities.DEFAULT;
			if (config.has(TARGET_FIELD)) {
				Object value = config.get(TARGET_FIELD);
				if (value instanceof JSONObject) {
					target = readTarget((JSONObject) value);
				} else {
					String name = config.getString(TARGET_FIELD);
					target = TargetCapabilities.named(name).orElseThrow(() -> new CnxOptionException(
							"unknown target " + name + "; known targets are " +
									String.join(", ", TargetCapabilities.getNames())));
				}
			}

			UnresolvedCallPolicy unresolved = UnresolvedCallPolicy.REJECT;
			if (config.has(UNRESOLVED_CALLS_FIELD)) {
				try {
					unresolved = UnresolvedCallPolicy.fromConfigName(config.getString(UNRESOLVED_CALLS_FIELD));
				} catch (IllegalArgumentException e) {
					throw new CnxOptionException(UNRESOLVED_CALLS_FIELD + ": " + e.getMessage());
				}
			}

			OpaqueCallPolicy opaque = OpaqueCallPolicy.CONSERVATIVE;
			if (config.has(OPAQUE_CALLS_FIELD)) {
				try {
					opaque = OpaqueCallPolicy.fromConfigName(config.getString(OPAQUE_CALLS_FIELD));
				} catch (IllegalArgumentException e) {
					throw new CnxOptionException(OPAQUE_CALLS_FIELD + ": " + e.getMessage());
				}
			}

			boolean debugGuards = config.optBoolean(DEBUG_GUARDS_FIELD, false);
			String output = config.optString(OUTPUT_FIELD, DEFAULT_OUTPUT);
			return new CnxAnalysisOptions(target, unresolved, opaque, debugGuards, output);
		} catch (JSONException e) {
			throw new CnxOptionException("configuration: " + e.getMessage());
		}
	}

	private static TargetCapabilities readTarget(JSONObject target) throws CnxOptionException {
		String name = target.optString("name", "custom");
		int wordSize = target.optInt("word_size", 32);
		if (wordSize != 8 && wordSize != 16 && wordSize != 32 && wordSize != 64) {
			throw new CnxOptionException("target " + name + ": unsupported word_size " + wordSize);
		}
		boolean selectiveMasking = target.optBoolean("selective_masking", false);
		Integer retryWidth = null;
		if (target.has("lock_free_retry_max_width") && !target.isNull("lock_free_retry_max_width")) {
			retryWidth = target.getInt("lock_free_retry_max_width");
		}
		return new TargetCapabilities(name, wordSize, selectiveMasking, retryWidth);
	}

	public TargetCapabilities getTarget() {
		return target;
	}

	public UnresolvedCallPolicy getUnresolvedCallPolicy() {
		return unresolvedCallPolicy;
	}

	public OpaqueCallPolicy getOpaqueCallPolicy() {
		return opaqueCallPolicy;
	}

	public boolean isDebugGuards() {
		return debugGuards;
	}

	public String getOutput() {
		return output;
	}

	public CnxAnalysisOptions withDebugGuards(boolean newDebugGuards) {
		return new CnxAnalysisOptions(target, unresolvedCallPolicy, opaqueCallPolicy, newDebugGuards, output);
	}

	public CnxAnalysisOptions withOutput(String newOutput) {
		return new CnxAnalysisOptions(target, unresolvedCallPolicy, opaqueCallPolicy, debugGuards, newOutput);
	}

	public CnxAnalysisOptions withTarget(TargetCapabilities newTarget) {
		return new CnxAnalysisOptions(newTarget, unresolvedCallPolicy, opaqueCallPolicy, debugGuards, output);
	}
}
