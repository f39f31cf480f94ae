package cnx.formatters;

import cnx.errors.IssueVisitor;
import cnx.errors.IssueWithContext;
import cnx.model.context.DuplicateContextIssue;
import cnx.model.context.ExecutionContext;
import cnx.trans.passes.access.MultiStepCandidate;
import cnx.trans.passes.access.UnprotectedAtomicMultiStepIssue;
import cnx.trans.passes.ceiling.OpaqueCallConservativeCeilingWarning;
import cnx.trans.passes.ceiling.UnprotectedResourceAccessIssue;
import cnx.trans.passes.parse.DuplicateResourceIssue;
import cnx.trans.passes.parse.OptionParserIssue;
import cnx.trans.passes.parse.ProgramLoadingIssue;
import cnx.trans.passes.reachability.MissingEntryFunctionIssue;
import cnx.trans.passes.reachability.UnresolvableCallIssue;
import cnx.trans.passes.validation.EarlyExitInCriticalRegionIssue;
import cnx.trans.passes.validation.NestedRegionWarning;
import cnx.trans.passes.validation.RedundantRegionWarning;

import java.io.IOException;
import java.util.ArrayList;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(ProgramLoadingIssue programLoadingIssue) throws IOException {
		out.write("malformed program export ");
		programLoadingIssue.getLocation().writePretty(out);
		out.write(": ");
		out.write(programLoadingIssue.getReason());
		return null;
	}

	@Override
	public Void visit(DuplicateContextIssue duplicateContextIssue) throws IOException {
		out.write("execution context ");
		out.write(duplicateContextIssue.getName());
		out.write(" declared ");
		duplicateContextIssue.getLocation().writePretty(out);
		out.write(" was already declared ");
		duplicateContextIssue.getPreviousLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(DuplicateResourceIssue duplicateResourceIssue) throws IOException {
		out.write("resource ");
		out.write(duplicateResourceIssue.getDeclaration().getName());
		out.write(" declared ");
		duplicateResourceIssue.getDeclaration().getLocation().writePretty(out);
		out.write(" was already declared ");
		duplicateResourceIssue.getPrevious().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(MissingEntryFunctionIssue missingEntryFunctionIssue) throws IOException {
		ExecutionContext context = missingEntryFunctionIssue.getContext();
		out.write("entry function ");
		out.write(context.getEntryFunction());
		out.write(" of execution context ");
		out.write(context.getName());
		out.write(" is not defined in the program");
		return null;
	}

	@Override
	public Void visit(UnresolvableCallIssue unresolvableCallIssue) throws IOException {
		out.write("indirect call ");
		unresolvableCallIssue.getCallSite().getLocation().writePretty(out);
		out.write(" cannot be resolved to a set of callees; set unresolved_calls to assume_all_contexts " +
				"to treat every address-taken function as reachable from every context");
		return null;
	}

	@Override
	public Void visit(UnprotectedAtomicMultiStepIssue unprotectedAtomicMultiStepIssue) throws IOException {
		MultiStepCandidate candidate = unprotectedAtomicMultiStepIssue.getCandidate();
		out.write("statement ");
		candidate.getStatement().getLocation().writePretty(out);
		out.write(" performs several dependent operations on shared resource ");
		out.write(candidate.getResource().getName());
		out.write(" without protection");
		if (candidate.getSuggestedRewrite().isPresent()) {
			out.write("; use the atomic form ");
			out.write(candidate.getSuggestedRewrite().get());
		} else {
			out.write("; wrap it in a critical block");
		}
		return null;
	}

	@Override
	public Void visit(UnprotectedResourceAccessIssue unprotectedResourceAccessIssue) throws IOException {
		out.write("modification of resource ");
		out.write(unprotectedResourceAccessIssue.getSite().getResource().getName());
		out.write(" ");
		unprotectedResourceAccessIssue.getSite().getLocation().writePretty(out);
		out.write(" is outside any critical block but the resource is shared with contexts ");
		FormattingTools.writeCommaSeparated(out,
				new ArrayList<>(unprotectedResourceAccessIssue.getResourceCeiling().getContexts()),
				c -> out.write(c.toString()));
		return null;
	}

	@Override
	public Void visit(OpaqueCallConservativeCeilingWarning opaqueCallConservativeCeilingWarning) throws IOException {
		out.write("critical block ");
		out.write(opaqueCallConservativeCeilingWarning.getRegion().getId());
		out.write(" ");
		opaqueCallConservativeCeilingWarning.getRegion().getLocation().writePretty(out);
		out.write(" calls ");
		FormattingTools.writeCommaSeparated(out,
				new ArrayList<>(opaqueCallConservativeCeilingWarning.getCallees()), out::write);
		out.write(", which may touch shared resources; ceiling raised to the highest interrupt priority ");
		out.write(Integer.toString(opaqueCallConservativeCeilingWarning.getCeiling()));
		out.write(". Inline the callee or analyze it separately to lower it");
		return null;
	}

	@Override
	public Void visit(EarlyExitInCriticalRegionIssue earlyExitInCriticalRegionIssue) throws IOException {
		out.write("cannot use '");
		out.write(earlyExitInCriticalRegionIssue.getKeyword());
		out.write("' ");
		earlyExitInCriticalRegionIssue.getExit().getLocation().writePretty(out);
		out.write(" inside critical block ");
		out.write(earlyExitInCriticalRegionIssue.getRegion().getId());
		out.write(": it would leave interrupts masked. Assign the result to a variable inside the block " +
				"and transfer control after the block ends");
		return null;
	}

	@Override
	public Void visit(RedundantRegionWarning redundantRegionWarning) throws IOException {
		out.write("critical block ");
		out.write(redundantRegionWarning.getRegion().getId());
		out.write(" ");
		redundantRegionWarning.getRegion().getLocation().writePretty(out);
		out.write(" adds no protection in context ");
		out.write(redundantRegionWarning.getContext().toString());
		out.write(": its ceiling ");
		out.write(Integer.toString(redundantRegionWarning.getCeiling()));
		out.write(" does not exceed the context's priority");
		return null;
	}

	@Override
	public Void visit(NestedRegionWarning nestedRegionWarning) throws IOException {
		out.write("critical block ");
		out.write(nestedRegionWarning.getInner().getId());
		out.write(" ");
		nestedRegionWarning.getInner().getLocation().writePretty(out);
		out.write(nestedRegionWarning.isThroughCall() ? " is entered through a call from inside " : " is nested in ");
		out.write("critical block ");
		out.write(nestedRegionWarning.getOuter().getId());
		return null;
	}
}
