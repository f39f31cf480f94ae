package cnx.errors;

import cnx.model.context.DuplicateContextIssue;
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

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(ProgramLoadingIssue programLoadingIssue) throws E;
	public abstract T visit(DuplicateContextIssue duplicateContextIssue) throws E;
	public abstract T visit(DuplicateResourceIssue duplicateResourceIssue) throws E;
	public abstract T visit(MissingEntryFunctionIssue missingEntryFunctionIssue) throws E;
	public abstract T visit(UnresolvableCallIssue unresolvableCallIssue) throws E;
	public abstract T visit(UnprotectedAtomicMultiStepIssue unprotectedAtomicMultiStepIssue) throws E;
	public abstract T visit(UnprotectedResourceAccessIssue unprotectedResourceAccessIssue) throws E;
	public abstract T visit(OpaqueCallConservativeCeilingWarning opaqueCallConservativeCeilingWarning) throws E;
	public abstract T visit(EarlyExitInCriticalRegionIssue earlyExitInCriticalRegionIssue) throws E;
	public abstract T visit(RedundantRegionWarning redundantRegionWarning) throws E;
	public abstract T visit(NestedRegionWarning nestedRegionWarning) throws E;
}
