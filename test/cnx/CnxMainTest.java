package cnx;

import cnx.errors.TopLevelIssueContext;
import cnx.formatters.EmissionReportFormatter;
import cnx.model.program.CnxProgram;
import cnx.trans.CnxTransException;
import cnx.trans.passes.codegen.EmissionPlan;
import cnx.trans.passes.codegen.TargetCapabilities;
import cnx.trans.passes.parse.ProgramLoadingPass;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class CnxMainTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static final Path PROGRAMS = Paths.get("test-resources", "programs");

	private static EmissionPlan analyzeExport(String name) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		CnxProgram program = ProgramLoadingPass.perform(ctx, PROGRAMS.resolve(name));
		assertFalse(ctx.format(), ctx.hasErrors());
		return CnxMain.analyze(ctx, program,
				CnxAnalysisOptions.defaults().withTarget(TargetCapabilities.named("cortex-m4").get()));
	}

	@Test
	public void writesReportAndPrelude() throws IOException {
		EmissionPlan plan = analyzeExport("uart_can.json");
		File report = new File(folder.getRoot(), "report.json");
		CnxMain.writeOutputs(plan, report.getPath());

		JSONObject json = new JSONObject(FileUtils.readFileToString(report, StandardCharsets.UTF_8));
		assertEquals("cortex-m4", json.getString("target"));
		assertEquals(4, json.getInt("max_priority"));

		JSONArray regions = json.getJSONArray("regions");
		assertEquals(3, regions.length());
		JSONObject mainRegion = regions.getJSONObject(0);
		assertEquals("main#1", mainRegion.getString("id"));
		assertEquals(9, mainRegion.getInt("line"));
		assertEquals(5, mainRegion.getInt("column"));
		assertEquals(4, mainRegion.getInt("ceiling"));
		assertEquals(
				"uint32_t __cnx_basepri_1 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(4));",
				mainRegion.getString("enter"));
		assertEquals(JSONObject.NULL, mainRegion.get("nesting_parent"));

		JSONObject uartRegion = regions.getJSONObject(1);
		assertEquals("uart_rx_handler#1", uartRegion.getString("id"));
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_2);", uartRegion.getString("exit"));

		JSONObject canRegion = regions.getJSONObject(2);
		assertEquals("none", canRegion.getString("strategy"));

		JSONObject read = json.getJSONArray("access_sites").getJSONObject(0);
		assertEquals("sharedBuffer", read.getString("resource"));
		assertEquals("read", read.getString("operation"));
		assertEquals("main#1", read.getString("protected_by"));

		File prelude = new File(folder.getRoot(), "report.h");
		assertTrue(prelude.exists());
		String header = FileUtils.readFileToString(prelude, StandardCharsets.UTF_8);
		assertTrue(header.contains("__cnx_set_BASEPRI_MAX"));
	}

	@Test
	public void atomicCounterUsesRetryLoop() {
		EmissionPlan plan = analyzeExport("uart_can.json");
		JSONArray sites = EmissionReportFormatter.format(plan).getJSONArray("access_sites");
		JSONObject reset = sites.getJSONObject(1);
		assertEquals("rxCount", reset.getString("resource"));
		assertEquals("none", reset.getString("strategy"));

		JSONObject increment = sites.getJSONObject(2);
		assertEquals("rxCount", increment.getString("resource"));
		assertEquals("main", increment.getString("function"));
		assertEquals(13, increment.getInt("line"));
		assertEquals("read_modify_write", increment.getString("operation"));
		assertEquals("lock-free-retry", increment.getString("strategy"));
		assertTrue(increment.getString("enter").contains("uint32_t __cnx_old_3 = __LDREXW(&rxCount);"));

		// the handler runs at the counter's ceiling
		JSONObject handlerIncrement = sites.getJSONObject(4);
		assertEquals("uart_rx_handler", handlerIncrement.getString("function"));
		assertEquals(19, handlerIncrement.getInt("line"));
		assertEquals("none", handlerIncrement.getString("strategy"));
	}

	@Test
	public void earlyReturnStopsAnalysis() {
		try {
			analyzeExport("early_return.json");
			fail("expected the early return to be rejected");
		} catch (CnxTransException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("cannot use 'return' at 6:9"));
		}
	}
}
