package cnx;

import cnx.errors.TopLevelIssueContext;
import cnx.formatters.EmissionReportFormatter;
import cnx.formatters.IndentingWriter;
import cnx.formatters.PreludeFormatter;
import cnx.model.context.ContextRegistry;
import cnx.model.program.CnxProgram;
import cnx.trans.CnxTransException;
import cnx.trans.passes.access.AccessCollection;
import cnx.trans.passes.access.AccessCollectionPass;
import cnx.trans.passes.ceiling.CeilingCalculationPass;
import cnx.trans.passes.ceiling.CeilingTable;
import cnx.trans.passes.codegen.EmissionPass;
import cnx.trans.passes.codegen.EmissionPlan;
import cnx.trans.passes.context.ContextRegistrationPass;
import cnx.trans.passes.debug.DebugGuardInjectionPass;
import cnx.trans.passes.parse.OptionParsingPass;
import cnx.trans.passes.parse.ProgramLoadingPass;
import cnx.trans.passes.reachability.Reachability;
import cnx.trans.passes.reachability.ReachabilityPass;
import cnx.trans.passes.validation.RegionNesting;
import cnx.trans.passes.validation.RegionValidationPass;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class CnxMain {
	private static final Logger logger = Logger.getLogger("CnxMain");

	private String[] cmdArgs;

	public CnxMain(String[] args) {
		cmdArgs = args;
	}

	public static void main(String[] args) {
		if (new CnxMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * Runs every analysis stage on a loaded program and returns the emission plan. Stops after
	 * the first stage that records an error.
	 */
	public static EmissionPlan analyze(TopLevelIssueContext ctx, CnxProgram program, CnxAnalysisOptions options)
			throws CnxTransException {
		logger.info("Registering execution contexts");
		ContextRegistry contexts = ContextRegistrationPass.perform(ctx, program);
		checkErrors(ctx);

		logger.info("Computing reachability");
		Reachability reachability = ReachabilityPass.perform(ctx, program, contexts, options.getUnresolvedCallPolicy());
		checkErrors(ctx);

		logger.info("Collecting resource accesses");
		AccessCollection collection = AccessCollectionPass.perform(program, reachability);

		logger.info("Calculating ceilings");
		CeilingTable ceilings = CeilingCalculationPass.perform(
				ctx, contexts, reachability, collection, options.getOpaqueCallPolicy());
		checkErrors(ctx);

		logger.info("Validating critical regions");
		RegionNesting nesting = RegionValidationPass.perform(ctx, program, reachability, collection, ceilings);
		checkErrors(ctx);

		logger.info("Selecting synchronization for target " + options.getTarget().getName());
		EmissionPlan plan = EmissionPass.perform(reachability, collection, ceilings, nesting, options.getTarget());

		if (options.isDebugGuards()) {
			logger.info("Injecting debug guards");
			plan = DebugGuardInjectionPass.perform(plan, ceilings);
		}
		return plan;
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			// Check options, set up logging.
			CnxOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			logger.info("Loading program export");
			CnxProgram program = ProgramLoadingPass.perform(ctx, Paths.get(opts.inputFilePath));
			checkErrors(ctx);

			EmissionPlan plan = analyze(ctx, program, opts.analysis);
			if (!ctx.getWarnings().isEmpty()) {
				logger.warning(ctx.formatWarnings());
			}

			writeOutputs(plan, opts.analysis.getOutput());
		} catch (CnxTransException | IOException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	static void writeOutputs(EmissionPlan plan, String output) throws IOException {
		File reportFile = new File(output);
		logger.info("Writing emission report to \"" + reportFile + "\"");
		FileUtils.writeStringToFile(reportFile, EmissionReportFormatter.format(plan).toString(2) + "\n",
				StandardCharsets.UTF_8);

		File preludeFile = new File(FilenameUtils.removeExtension(output) + ".h");
		logger.info("Writing C prelude to \"" + preludeFile + "\"");
		StringWriter w = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(w)) {
			new PreludeFormatter(out).format(plan);
		}
		FileUtils.writeStringToFile(preludeFile, w.toString(), StandardCharsets.UTF_8);
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws CnxTransException {
		if (ctx.hasErrors()) {
			throw new CnxTransException(ctx.format());
		}
	}
}
