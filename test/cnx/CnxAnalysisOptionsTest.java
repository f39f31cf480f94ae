package cnx;

import cnx.trans.passes.ceiling.OpaqueCallPolicy;
import cnx.trans.passes.codegen.TargetCapabilities;
import cnx.trans.passes.reachability.UnresolvedCallPolicy;
import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class CnxAnalysisOptionsTest {
	private JSONObject config;

	@Before
	public void setup() throws IOException {
		config = new JSONObject(FileUtils.readFileToString(
				Paths.get("test-resources", "configs", "cortex_m4.json").toFile(), StandardCharsets.UTF_8));
	}

	private static JSONObject json(String text) {
		return new JSONObject(text);
	}

	@Test
	public void allFields() throws CnxOptionException {
		CnxAnalysisOptions options = CnxAnalysisOptions.fromJSON(config);
		assertEquals(TargetCapabilities.named("cortex-m4").get(), options.getTarget());
		assertEquals(UnresolvedCallPolicy.ASSUME_ALL_CONTEXTS, options.getUnresolvedCallPolicy());
		assertEquals(OpaqueCallPolicy.FOOTPRINT, options.getOpaqueCallPolicy());
		assertTrue(options.isDebugGuards());
		assertEquals("build/critical.json", options.getOutput());
	}

	@Test
	public void emptyConfigurationIsTheDefault() throws CnxOptionException {
		CnxAnalysisOptions options = CnxAnalysisOptions.fromJSON(json("{}"));
		CnxAnalysisOptions defaults = CnxAnalysisOptions.defaults();
		assertEquals(defaults.getTarget(), options.getTarget());
		assertEquals(TargetCapabilities.DEFAULT, options.getTarget());
		assertEquals(UnresolvedCallPolicy.REJECT, options.getUnresolvedCallPolicy());
		assertEquals(OpaqueCallPolicy.CONSERVATIVE, options.getOpaqueCallPolicy());
		assertFalse(options.isDebugGuards());
		assertEquals(CnxAnalysisOptions.DEFAULT_OUTPUT, options.getOutput());
	}

	@Test
	public void customTarget() throws IOException, CnxOptionException {
		JSONObject custom = new JSONObject(FileUtils.readFileToString(
				Paths.get("test-resources", "configs", "custom_target.json").toFile(), StandardCharsets.UTF_8));
		TargetCapabilities target = CnxAnalysisOptions.fromJSON(custom).getTarget();
		assertEquals("rp2040", target.getName());
		assertEquals(32, target.getWordSize());
		assertFalse(target.supportsSelectiveMasking());
		assertFalse(target.getLockFreeRetryMaxWidth().isPresent());
	}

	@Test
	public void withersKeepOtherFields() throws CnxOptionException {
		CnxAnalysisOptions options = CnxAnalysisOptions.fromJSON(config)
				.withTarget(TargetCapabilities.named("cortex-m0").get())
				.withOutput("out.json")
				.withDebugGuards(false);
		assertEquals("cortex-m0", options.getTarget().getName());
		assertEquals("out.json", options.getOutput());
		assertFalse(options.isDebugGuards());
		assertEquals(OpaqueCallPolicy.FOOTPRINT, options.getOpaqueCallPolicy());
	}

	@Test(expected = CnxOptionException.class)
	public void unknownTarget() throws CnxOptionException {
		CnxAnalysisOptions.fromJSON(json("{\"target\": \"z80\"}"));
	}

	@Test(expected = CnxOptionException.class)
	public void unknownUnresolvedCallPolicy() throws CnxOptionException {
		CnxAnalysisOptions.fromJSON(json("{\"unresolved_calls\": \"guess\"}"));
	}

	@Test(expected = CnxOptionException.class)
	public void unknownOpaqueCallPolicy() throws CnxOptionException {
		CnxAnalysisOptions.fromJSON(json("{\"opaque_calls\": \"ignore\"}"));
	}

	@Test(expected = CnxOptionException.class)
	public void unsupportedWordSize() throws CnxOptionException {
		CnxAnalysisOptions.fromJSON(json("{\"target\": {\"word_size\": 24}}"));
	}

	@Test
	public void unknownTargetMessageListsKnownTargets() {
		try {
			CnxAnalysisOptions.fromJSON(json("{\"target\": \"z80\"}"));
			fail("expected an unknown target to be rejected");
		} catch (CnxOptionException e) {
			assertTrue(e.getMessage().contains("cortex-m4"));
		}
	}
}
