package cnx.trans.passes.context;

import cnx.errors.IssueContext;
import cnx.model.context.ContextKind;
import cnx.model.context.ContextRegistry;
import cnx.model.context.DuplicateContextIssue;
import cnx.model.program.CnxContextDeclaration;
import cnx.model.program.CnxProgram;
import cnx.util.SourceLocation;

public class ContextRegistrationPass {
	private ContextRegistrationPass() {}

	/**
	 * Registers every declared context. Duplicates are all reported, and the first declaration
	 * of a name wins. A program that declares no main context gets one named "main" entered
	 * through the function "main".
	 */
	public static ContextRegistry perform(IssueContext ctx, CnxProgram program) {
		ContextRegistry.Builder builder = ContextRegistry.builder();
		for (CnxContextDeclaration declaration : program.getContexts()) {
			try {
				builder.register(declaration.getLocation(), declaration.getName(), declaration.getKind(),
						declaration.getPriority(), declaration.getEntryFunction());
			} catch (DuplicateContextIssue issue) {
				ctx.error(issue);
			}
		}
		if (!builder.hasMain()) {
			try {
				builder.register(SourceLocation.unknown(), ContextRegistry.MAIN_CONTEXT_NAME, ContextKind.MAIN, 0,
						ContextRegistry.MAIN_CONTEXT_NAME);
			} catch (DuplicateContextIssue issue) {
				// an interrupt already took the name "main"
				ctx.error(issue);
			}
		}
		return builder.build();
	}
}
