package cnx;

import cnx.trans.passes.codegen.TargetCapabilities;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class CnxOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-g Prefix every critical section with a run-time ceiling check", aliases = {"-debug-guards"})
	public boolean debugGuards = false;

	@Option(value = "-o path of the JSON emission report; the C prelude is written next to it")
	public String outputPath;

	@Option(value = "-t target name, overriding the configuration file")
	public String targetName;

	public String inputFilePath;

	// built from the JSON configuration file and the flags above
	public CnxAnalysisOptions analysis;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public CnxOptions(String[] args) {
		plumeOptions = new Options("cnx-critical [options] program-export.json", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void parse() throws CnxOptionException {
		if (version) {
			System.out.println("cnx-critical version " + VERSION);
			System.exit(0);
		}

		if (help || remainingArgs.length != 1) {
			printHelp();
			System.exit(0);
		}

		inputFilePath = remainingArgs[0];

		CnxAnalysisOptions options = CnxAnalysisOptions.defaults();
		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new CnxOptionException("Error reading configuration file: " + ex.getMessage());
			}

			JSONObject config;
			try {
				config = new JSONObject(s);
			} catch (JSONException e) {
				throw new CnxOptionException(configFilePath + ": parsing error: " + e.getMessage());
			}
			options = CnxAnalysisOptions.fromJSON(config);
		}

		if (targetName != null) {
			options = options.withTarget(TargetCapabilities.named(targetName)
					.orElseThrow(() -> new CnxOptionException("unknown target " + targetName)));
		}
		if (debugGuards) {
			options = options.withDebugGuards(true);
		}
		if (outputPath != null) {
			options = options.withOutput(outputPath);
		}
		analysis = options;
	}
}
