package cnx.trans.passes.parse;

import cnx.CnxOptionException;
import cnx.CnxOptions;
import cnx.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static CnxOptions perform(IssueContext ctx, Logger logger, String[] args) {
		CnxOptions opts = new CnxOptions(args);
		try {
			opts.parse();
		} catch (CnxOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
