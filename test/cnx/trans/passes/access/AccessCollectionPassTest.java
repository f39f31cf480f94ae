package cnx.trans.passes.access;

import cnx.errors.TopLevelIssueContext;
import cnx.model.context.ContextRegistry;
import cnx.model.context.ExecutionContext;
import cnx.model.program.*;
import cnx.trans.passes.context.ContextRegistrationPass;
import cnx.trans.passes.reachability.ReachabilityPass;
import cnx.trans.passes.reachability.UnresolvedCallPolicy;
import org.junit.Test;

import java.util.*;
import java.util.stream.Collectors;

import static cnx.model.program.CnxBuilder.*;
import static org.junit.Assert.*;

public class AccessCollectionPassTest {

	private static final CnxResourceDeclaration COUNTER = atomic("counter", CnxType.U32);
	private static final CnxResourceDeclaration BUFFER = shared("buffer", CnxType.U8);
	private static final CnxResourceDeclaration FLAG = shared("flag", CnxType.BOOL);

	private static AccessCollection collect(CnxProgram program, UnresolvedCallPolicy policy) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ContextRegistry contexts = ContextRegistrationPass.perform(ctx, program);
		AccessCollection collection = AccessCollectionPass.perform(
				program, ReachabilityPass.perform(ctx, program, contexts, policy));
		assertFalse(ctx.format(), ctx.hasErrors());
		return collection;
	}

	private static AccessCollection collect(CnxProgram program) {
		return collect(program, UnresolvedCallPolicy.REJECT);
	}

	private static List<String> names(Collection<CnxResourceDeclaration> resources) {
		return resources.stream().map(CnxResourceDeclaration::getName).collect(Collectors.toList());
	}

	@Test
	public void classifiesOperations() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(COUNTER, BUFFER),
				function("main",
						assign("buffer", num(1)),
						assign("counter", "+<-", num(2)),
						local("copy", idexp("buffer"))));
		List<AccessSite> sites = collect(program).getSites();
		assertEquals(3, sites.size());

		assertEquals(BUFFER, sites.get(0).getResource());
		assertEquals(AccessOperation.WRITE, sites.get(0).getOperation());
		assertEquals(Optional.of(AssignmentOperator.ASSIGN), sites.get(0).getAssignmentOperator());

		assertEquals(COUNTER, sites.get(1).getResource());
		assertEquals(AccessOperation.READ_MODIFY_WRITE, sites.get(1).getOperation());
		assertTrue(sites.get(1).isAtomicForm());
		assertTrue(sites.get(1).getOperation().isMutation());

		assertEquals(AccessOperation.READ, sites.get(2).getOperation());
		assertFalse(sites.get(2).getAssignmentOperator().isPresent());
		assertFalse(sites.get(2).getOperation().isMutation());
		assertFalse(sites.get(2).getEnclosingRegion().isPresent());
	}

	@Test
	public void valueIsReadBeforeTargetIsWritten() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(COUNTER, BUFFER),
				function("main", critical(assign("buffer", idexp("counter")))));
		List<AccessSite> sites = collect(program).getSites();
		assertEquals(2, sites.size());
		assertEquals(COUNTER, sites.get(0).getResource());
		assertEquals(AccessOperation.READ, sites.get(0).getOperation());
		assertEquals(BUFFER, sites.get(1).getResource());
		assertEquals(AccessOperation.WRITE, sites.get(1).getOperation());
	}

	@Test
	public void localsShadowResources() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(COUNTER, BUFFER),
				function("main", Collections.singletonList("counter"),
						assign("counter", num(1)),
						block(
								local("buffer", num(0)),
								assign("buffer", num(2))),
						assign("buffer", num(3))));
		List<AccessSite> sites = collect(program).getSites();
		// the parameter hides counter everywhere, the local hides buffer only inside its block
		assertEquals(1, sites.size());
		assertEquals(BUFFER, sites.get(0).getResource());
		assertEquals(AccessOperation.WRITE, sites.get(0).getOperation());
	}

	@Test
	public void sitesCarryTheirFunctionsContexts() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 2, "isr_handler")),
				Collections.singletonList(BUFFER),
				function("main", callS("write_buffer")),
				function("isr_handler", callS("write_buffer")),
				function("write_buffer", assign("buffer", num(0))));
		AccessCollection collection = collect(program);
		List<AccessSite> sites = collection.getSitesOn(BUFFER);
		assertEquals(1, sites.size());
		assertEquals("write_buffer", sites.get(0).getOwningFunction());
		assertEquals(Arrays.asList("main", "isr"),
				sites.get(0).getContexts().stream().map(ExecutionContext::getName).collect(Collectors.toList()));
	}

	@Test
	public void regionIdsArePreOrderPerFunction() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(BUFFER, FLAG),
				function("main",
						critical(
								assign("buffer", num(1)),
								critical(assign("flag", bool(true)))),
						critical(assign("buffer", num(2)))),
				function("other", critical()));
		AccessCollection collection = collect(program);
		assertEquals(Arrays.asList("main#1", "main#2", "main#3", "other#1"),
				collection.getRegions().stream().map(CriticalRegion::getId).collect(Collectors.toList()));

		CriticalRegion outer = collection.findRegion("main#1").get();
		CriticalRegion inner = collection.findRegion("main#2").get();
		assertEquals(Optional.of(outer), inner.getLexicalParent());
		assertEquals(Arrays.asList("buffer", "flag"), names(outer.getDirectResources()));
		assertEquals(Collections.singletonList("flag"), names(inner.getDirectResources()));
		assertEquals(Arrays.asList("main#1", "main#2", "main#3"),
				collection.getRegionsIn("main").stream().map(CriticalRegion::getId).collect(Collectors.toList()));

		AccessSite flagWrite = collection.getSitesOn(FLAG).get(0);
		assertEquals(Optional.of(inner), flagWrite.getEnclosingRegion());
		assertEquals(Optional.of(outer), collection.findRegion(outer.getBlock()));
		assertFalse(collection.findRegion("main#9").isPresent());
	}

	@Test
	public void calleesOfRegions() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(BUFFER, FLAG),
				Collections.singleton("HAL_GPIO_Write"),
				function("main",
						critical(
								callS("pure"),
								callS("touches_flag"),
								callS("HAL_GPIO_Write", num(1))),
						critical(callS("calls_external"))),
				function("pure", local("x", num(1))),
				function("touches_flag", callS("sets_flag")),
				function("sets_flag", assign("flag", bool(true))),
				function("calls_external", callS("HAL_GPIO_Write", num(0))));
		AccessCollection collection = collect(program);

		CriticalRegion first = collection.findRegion("main#1").get();
		assertTrue(first.containsOpaqueCall());
		assertEquals(Collections.singleton("HAL_GPIO_Write"), first.getUnanalyzableCallees());
		assertEquals(Collections.singleton("touches_flag"), first.getResourceTouchingCallees());
		assertEquals(Collections.singletonList("flag"), names(first.getCalleeFootprint()));
		assertTrue(first.getDirectResources().isEmpty());

		CriticalRegion second = collection.findRegion("main#2").get();
		assertEquals(Collections.singleton("calls_external"), second.getUnanalyzableCallees());

		assertTrue(collection.getFootprint("pure").get().isResourceFree());
		assertEquals(Collections.singletonList("flag"), names(collection.getFootprint("touches_flag").get().getResources()));
		assertTrue(collection.getFootprint("touches_flag").get().isAnalyzable());
		assertFalse(collection.getFootprint("calls_external").get().isAnalyzable());
	}

	@Test
	public void indirectCallInsideRegion() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Collections.emptyList(),
				function("main", critical(exprS(indirectCall(idexp("handler"))))),
				callback("handler"));
		AccessCollection collection = collect(program, UnresolvedCallPolicy.ASSUME_ALL_CONTEXTS);
		CriticalRegion region = collection.findRegion("main#1").get();
		assertEquals(Collections.singleton(AccessCollectionPass.INDIRECT_CALLEE), region.getOpaqueCallees());
	}

	@Test
	public void regionWithOnlyPureCallsIsNotOpaque() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Collections.emptyList(),
				function("main", critical(callS("pure"))),
				function("pure"));
		CriticalRegion region = collect(program).findRegion("main#1").get();
		assertFalse(region.containsOpaqueCall());
	}

	@Test
	public void multiStepCandidates() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(COUNTER, BUFFER, FLAG),
				function("main",
						// not multi-step: atomic compound form
						assign("counter", "+<-", num(1)),
						// compound on a region-scoped resource
						assign("buffer", "+<-", num(1)),
						// read of the target on the right
						assign("counter", binop("+", idexp("counter"), num(5))),
						// read of the target twice, no rewrite possible
						assign("counter", binop("+", idexp("counter"), idexp("counter"))),
						// another resource read twice
						assign("flag", binop("&&", idexp("buffer"), idexp("buffer"))),
						// inside a region nothing is reported
						critical(assign("buffer", binop("+", idexp("buffer"), num(1))))));
		List<MultiStepCandidate> candidates = collect(program).getMultiStepCandidates();
		assertEquals(4, candidates.size());

		assertEquals(BUFFER, candidates.get(0).getResource());
		assertFalse(candidates.get(0).getSuggestedRewrite().isPresent());

		assertEquals(COUNTER, candidates.get(1).getResource());
		assertEquals(Optional.of("counter +<- 5;"), candidates.get(1).getSuggestedRewrite());

		assertEquals(COUNTER, candidates.get(2).getResource());
		assertFalse(candidates.get(2).getSuggestedRewrite().isPresent());

		assertEquals(BUFFER, candidates.get(3).getResource());
		assertEquals("main", candidates.get(3).getOwningFunction());
	}

	@Test
	public void repeatedReadsIntoLocals() {
		CnxAssignment sum = assign("t", binop("+", idexp("buffer"), idexp("buffer")));
		CnxLocalDeclaration both = local("u", binop("&&", idexp("flag"), idexp("flag")));
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Arrays.asList(BUFFER, FLAG),
				function("main", Collections.singletonList("t"), sum, both));
		List<MultiStepCandidate> candidates = collect(program).getMultiStepCandidates();
		assertEquals(2, candidates.size());
		assertEquals(BUFFER, candidates.get(0).getResource());
		assertSame(sum, candidates.get(0).getStatement());
		assertEquals(FLAG, candidates.get(1).getResource());
		assertSame(both, candidates.get(1).getStatement());
	}

	@Test
	public void compoundUpdateFromEarlierRead() {
		CnxAssignment doubling = assign("counter", "+<-", idexp("t"));
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Collections.singletonList(COUNTER),
				function("main",
						local("t", idexp("counter")),
						doubling,
						// a single plain load into a local is an atomic form
						local("u", idexp("counter"))));
		List<MultiStepCandidate> candidates = collect(program).getMultiStepCandidates();
		assertEquals(1, candidates.size());
		assertEquals(COUNTER, candidates.get(0).getResource());
		assertSame(doubling, candidates.get(0).getStatement());
	}
}
