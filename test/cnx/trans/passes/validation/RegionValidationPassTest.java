package cnx.trans.passes.validation;

import cnx.errors.Issue;
import cnx.errors.IssueWithContext;
import cnx.errors.TopLevelIssueContext;
import cnx.model.context.ContextRegistry;
import cnx.model.program.CnxBreak;
import cnx.model.program.CnxProgram;
import cnx.model.program.CnxStatement;
import cnx.model.program.CnxType;
import cnx.trans.passes.access.AccessCollection;
import cnx.trans.passes.access.AccessCollectionPass;
import cnx.trans.passes.access.CriticalRegion;
import cnx.trans.passes.ceiling.CeilingCalculationPass;
import cnx.trans.passes.ceiling.CeilingTable;
import cnx.trans.passes.ceiling.OpaqueCallPolicy;
import cnx.trans.passes.context.ContextRegistrationPass;
import cnx.trans.passes.reachability.Reachability;
import cnx.trans.passes.reachability.ReachabilityPass;
import cnx.trans.passes.reachability.UnresolvedCallPolicy;
import org.junit.Test;

import java.util.*;
import java.util.stream.Collectors;

import static cnx.model.program.CnxBuilder.*;
import static org.junit.Assert.*;

public class RegionValidationPassTest {

	private TopLevelIssueContext ctx;
	private AccessCollection collection;

	private RegionNesting validate(CnxProgram program) {
		ctx = new TopLevelIssueContext();
		ContextRegistry contexts = ContextRegistrationPass.perform(ctx, program);
		Reachability reachability = ReachabilityPass.perform(ctx, program, contexts, UnresolvedCallPolicy.REJECT);
		collection = AccessCollectionPass.perform(program, reachability);
		CeilingTable ceilings = CeilingCalculationPass.perform(
				ctx, contexts, reachability, collection, OpaqueCallPolicy.FOOTPRINT);
		assertFalse(ctx.format(), ctx.hasErrors());
		return RegionValidationPass.perform(ctx, program, reachability, collection, ceilings);
	}

	private CriticalRegion region(String id) {
		return collection.findRegion(id).get();
	}

	private static Issue unwrap(Issue issue) {
		return issue instanceof IssueWithContext ? ((IssueWithContext) issue).getIssue() : issue;
	}

	private <T extends Issue> List<T> warnings(Class<T> kind) {
		return ctx.getWarnings().stream()
				.map(RegionValidationPassTest::unwrap)
				.filter(kind::isInstance)
				.map(kind::cast)
				.collect(Collectors.toList());
	}

	private EarlyExitInCriticalRegionIssue onlyError() {
		assertEquals(ctx.format(), 1, ctx.getIssues().size());
		return (EarlyExitInCriticalRegionIssue) unwrap(ctx.getIssues().get(0));
	}

	private static CnxProgram mainOnly(CnxStatement... body) {
		return program(
				Collections.singletonList(mainContext("main")),
				Collections.singletonList(shared("x", CnxType.U32)),
				function("main", Collections.singletonList("result"), body));
	}

	@Test
	public void returnInsideRegion() {
		validate(mainOnly(
				critical(returnS(idexp("x")))));
		EarlyExitInCriticalRegionIssue issue = onlyError();
		assertEquals("return", issue.getKeyword());
		assertEquals("main#1", issue.getRegion().getId());
	}

	@Test
	public void returnAfterRegion() {
		validate(mainOnly(
				critical(assign("result", idexp("x"))),
				returnS(idexp("result"))));
		assertFalse(ctx.format(), ctx.hasErrors());
	}

	@Test
	public void returnInsideNestedStatementsOfRegion() {
		validate(mainOnly(
				critical(ifS(binop(">", idexp("x"), num(0)),
						Collections.singletonList(whileS(bool(true), returnS())),
						Collections.emptyList()))));
		assertEquals("return", onlyError().getKeyword());
	}

	@Test
	public void breakInsideLoopWithinRegion() {
		validate(mainOnly(
				critical(
						whileS(bool(true), breakS()),
						doWhile(bool(false), continueS()))));
		assertFalse(ctx.format(), ctx.hasErrors());
	}

	@Test
	public void breakOutOfRegion() {
		validate(mainOnly(
				whileS(bool(true), critical(breakS()))));
		EarlyExitInCriticalRegionIssue issue = onlyError();
		assertEquals("break", issue.getKeyword());
		assertTrue(issue.getExit() instanceof CnxBreak);
	}

	@Test
	public void continueOutOfRegion() {
		validate(mainOnly(
				doWhile(bool(false), critical(block(continueS())))));
		assertEquals("continue", onlyError().getKeyword());
	}

	@Test
	public void innermostRegionIsReported() {
		validate(mainOnly(
				critical(critical(returnS()))));
		assertEquals("main#2", onlyError().getRegion().getId());
	}

	@Test
	public void lexicalNesting() {
		CnxProgram program = program(
				Arrays.asList(
						mainContext("main"),
						interrupt("uart", 2, "uart_handler"),
						interrupt("can", 4, "can_handler")),
				Arrays.asList(shared("a", CnxType.U8), shared("b", CnxType.U8)),
				function("main",
						critical(
								assign("a", num(1)),
								critical(assign("b", num(2))))),
				function("uart_handler", critical(assign("b", num(3)))),
				function("can_handler", critical(assign("a", num(4)))));
		RegionNesting nesting = validate(program);
		assertFalse(ctx.format(), ctx.hasErrors());

		assertEquals(Optional.of(region("main#1")), nesting.getNestingParent(region("main#2")));
		assertEquals(Collections.singletonList(region("main#1")), nesting.getEnclosingRegions(region("main#2")));
		assertFalse(nesting.getNestingParent(region("main#1")).isPresent());
		assertTrue(nesting.getEnclosingRegions(region("main#1")).isEmpty());

		List<NestedRegionWarning> nested = warnings(NestedRegionWarning.class);
		assertEquals(1, nested.size());
		assertEquals("main#2", nested.get(0).getInner().getId());
		assertEquals("main#1", nested.get(0).getOuter().getId());
		assertFalse(nested.get(0).isThroughCall());
	}

	@Test
	public void nestingThroughCalls() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 3, "isr_handler")),
				Collections.singletonList(shared("a", CnxType.U8)),
				function("main", critical(callS("relay"))),
				function("relay", callS("update")),
				function("update", critical(assign("a", num(1)))),
				function("isr_handler", critical(assign("a", num(2)))));
		RegionNesting nesting = validate(program);
		assertFalse(ctx.format(), ctx.hasErrors());
		assertEquals(Optional.of(region("main#1")), nesting.getNestingParent(region("update#1")));

		List<NestedRegionWarning> nested = warnings(NestedRegionWarning.class);
		assertEquals(1, nested.size());
		assertTrue(nested.get(0).isThroughCall());
		assertEquals("update#1", nested.get(0).getInner().getId());
	}

	@Test
	public void redundantRegions() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 3, "isr_handler")),
				Collections.singletonList(shared("isr_state", CnxType.U16)),
				function("main", critical()),
				function("isr_handler", critical(assign("isr_state", num(1)))));
		validate(program);
		assertFalse(ctx.format(), ctx.hasErrors());
		List<RedundantRegionWarning> redundant = warnings(RedundantRegionWarning.class);
		assertEquals(2, redundant.size());
		assertEquals("main#1", redundant.get(0).getRegion().getId());
		assertEquals("main", redundant.get(0).getContext().getName());
		assertEquals(0, redundant.get(0).getCeiling());
		assertEquals("isr_handler#1", redundant.get(1).getRegion().getId());
		assertEquals(3, redundant.get(1).getCeiling());
	}

	@Test
	public void onlyRegionsAtTheirCeilingAreRedundant() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 3, "isr_handler")),
				Collections.singletonList(shared("a", CnxType.U16)),
				function("main", critical(assign("a", num(0)))),
				function("isr_handler", critical(assign("a", num(1)))));
		validate(program);
		List<RedundantRegionWarning> redundant = warnings(RedundantRegionWarning.class);
		assertEquals(1, redundant.size());
		assertEquals("isr_handler#1", redundant.get(0).getRegion().getId());
		assertEquals("isr", redundant.get(0).getContext().getName());
	}
}
