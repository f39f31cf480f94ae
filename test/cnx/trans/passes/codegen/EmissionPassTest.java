package cnx.trans.passes.codegen;

import cnx.CnxAnalysisOptions;
import cnx.CnxMain;
import cnx.errors.TopLevelIssueContext;
import cnx.model.program.CnxProgram;
import cnx.model.program.CnxType;
import cnx.trans.passes.access.AccessOperation;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static cnx.model.program.CnxBuilder.*;
import static org.junit.Assert.*;

public class EmissionPassTest {

	private static final TargetCapabilities CORTEX_M4 = TargetCapabilities.named("cortex-m4").get();
	private static final TargetCapabilities CORTEX_M0 = TargetCapabilities.named("cortex-m0").get();
	private static final TargetCapabilities CORTEX_M0_PLUS = TargetCapabilities.named("cortex-m0+").get();

	private static EmissionPlan plan(CnxProgram program, TargetCapabilities target) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		EmissionPlan plan = CnxMain.analyze(ctx, program, CnxAnalysisOptions.defaults().withTarget(target));
		assertFalse(ctx.format(), ctx.hasErrors());
		return plan;
	}

	private static CnxProgram uartAndCan() {
		return program(
				Arrays.asList(
						mainContext("main"),
						interrupt("UART_RX", 2, "uart_handler"),
						interrupt("CAN_RX", 4, "can_handler")),
				Collections.singletonList(shared("sharedBuffer", CnxType.U8)),
				function("main", critical(assign("sharedBuffer", num(0)))),
				function("uart_handler", critical(assign("sharedBuffer", num(1)))),
				function("can_handler", critical(assign("sharedBuffer", num(2)))));
	}

	@Test
	public void selectiveMaskOnCapableTarget() {
		EmissionPlan plan = plan(uartAndCan(), CORTEX_M4);
		RegionEmission uart = plan.findRegion("uart_handler#1").get();
		assertEquals(4, uart.getCeiling());
		assertEquals(SynchronizationStrategy.SELECTIVE_MASK, uart.getStrategy());
		assertEquals(
				"uint32_t __cnx_basepri_2 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(4));",
				uart.getEnter());
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_2);", uart.getExit());

		// the highest priority context already runs at the ceiling
		RegionEmission can = plan.findRegion("can_handler#1").get();
		assertEquals(SynchronizationStrategy.NONE, can.getStrategy());
		assertEquals("", can.getEnter());
		assertEquals("", can.getExit());
		assertTrue(plan.emitsCode());
	}

	@Test
	public void globalDisableOnIncapableTarget() {
		EmissionPlan plan = plan(uartAndCan(), CORTEX_M0);
		RegionEmission uart = plan.findRegion("uart_handler#1").get();
		assertEquals(SynchronizationStrategy.GLOBAL_DISABLE, uart.getStrategy());
		assertEquals("uint32_t __cnx_primask_2 = __cnx_get_PRIMASK();\n__cnx_disable_irq();", uart.getEnter());
		assertEquals("__cnx_set_PRIMASK(__cnx_primask_2);", uart.getExit());
		assertFalse(plan.getHelpers().contains(RuntimeHelper.SET_BASEPRI_MAX));
		assertTrue(plan.getHelpers().contains(RuntimeHelper.DISABLE_IRQ));
	}

	@Test
	public void equalPrioritiesNeedNothing() {
		CnxProgram program = program(
				Arrays.asList(
						mainContext("main"),
						interrupt("SPI_RX", 2, "spi_handler"),
						interrupt("TIM_RX", 2, "tim_handler")),
				Collections.singletonList(shared("logBuffer", CnxType.U32)),
				function("main"),
				function("spi_handler", critical(assign("logBuffer", num(1)))),
				function("tim_handler", assign("logBuffer", num(2))));
		EmissionPlan plan = plan(program, CORTEX_M4);
		assertEquals(SynchronizationStrategy.NONE, plan.findRegion("spi_handler#1").get().getStrategy());
		for (AccessSiteEmission site : plan.getSites()) {
			assertEquals(SynchronizationStrategy.NONE, site.getStrategy());
		}
		assertFalse(plan.emitsCode());
		assertTrue(plan.getHelpers().isEmpty());
	}

	@Test
	public void nestedRegionKeepsOuterMask() {
		CnxProgram program = program(
				Arrays.asList(
						mainContext("main"),
						interrupt("uart", 2, "uart_handler"),
						interrupt("can", 4, "can_handler")),
				Arrays.asList(shared("frame", CnxType.U8), shared("status", CnxType.U8)),
				function("main",
						critical(
								assign("frame", num(1)),
								critical(assign("status", num(2))))),
				function("uart_handler", critical(assign("status", num(3)))),
				function("can_handler", critical(assign("frame", num(4)))));
		EmissionPlan plan = plan(program, CORTEX_M4);

		RegionEmission outer = plan.findRegion("main#1").get();
		assertEquals(4, outer.getCeiling());
		assertEquals(
				"uint32_t __cnx_basepri_1 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(4));",
				outer.getEnter());

		RegionEmission inner = plan.findRegion("main#2").get();
		assertEquals(2, inner.getCeiling());
		assertEquals(SynchronizationStrategy.SELECTIVE_MASK, inner.getStrategy());
		assertEquals(outer.getRegion(), inner.getNestingParent().get());
		// already masked at 4 on entry: no raise, and the exit restores what was saved
		assertEquals("uint32_t __cnx_basepri_2 = __cnx_get_BASEPRI();", inner.getEnter());
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_2);", inner.getExit());
	}

	@Test
	public void sitesInsideRegionsShareTheirProtection() {
		EmissionPlan plan = plan(uartAndCan(), CORTEX_M4);
		AccessSiteEmission mainWrite = plan.getSites().get(0);
		assertEquals("main", mainWrite.getSite().getOwningFunction());
		assertEquals(SynchronizationStrategy.SELECTIVE_MASK, mainWrite.getStrategy());
		assertEquals("main#1", mainWrite.getProtectingRegion().get().getId());
		assertFalse(mainWrite.getTemplate().isPresent());
		assertTrue(plan.getProtectedSites().isEmpty());
	}

	private static CnxProgram atomicCounters() {
		return program(
				Arrays.asList(mainContext("main"), interrupt("isr", 2, "isr_handler")),
				Arrays.asList(
						atomic("c8", CnxType.U8),
						atomic("c16", CnxType.I16),
						atomic("c32", CnxType.U32),
						atomic("c64", CnxType.U64)),
				function("main",
						assign("c8", "+<-", num(1)),
						assign("c16", "-<-", num(1)),
						assign("c32", "|<-", num(1)),
						assign("c64", "+<-", num(1))),
				function("isr_handler",
						assign("c8", "+<-", num(1)),
						assign("c16", "+<-", num(1)),
						assign("c32", "+<-", num(1)),
						assign("c64", "+<-", num(1))));
	}

	private static List<SynchronizationStrategy> mainStrategies(EmissionPlan plan) {
		return plan.getSites().stream()
				.filter(s -> s.getSite().getOwningFunction().equals("main"))
				.map(AccessSiteEmission::getStrategy)
				.collect(Collectors.toList());
	}

	@Test
	public void lockFreeRetryByWidth() {
		EmissionPlan plan = plan(atomicCounters(), CORTEX_M4);
		assertEquals(Arrays.asList(
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.SELECTIVE_MASK), mainStrategies(plan));

		List<AccessSiteEmission> sites = plan.getSites();
		assertTrue(sites.get(0).getEnter().contains("uint8_t __cnx_old_1 = __LDREXB(&c8);"));
		assertTrue(sites.get(1).getEnter().contains("int16_t __cnx_old_2 = __LDREXH(&c16);"));
		assertTrue(sites.get(1).getEnter().endsWith("__cnx_old_2 - ("));
		assertTrue(sites.get(2).getExit().contains("__STREXW(__cnx_new_3, &c32)"));
		assertEquals(
				"uint32_t __cnx_basepri_4 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(2));",
				sites.get(3).getEnter());

		// the interrupt runs at the ceiling of every counter
		for (AccessSiteEmission site : sites.subList(4, 8)) {
			assertEquals(SynchronizationStrategy.NONE, site.getStrategy());
		}
	}

	@Test
	public void retryOnlyTarget() {
		EmissionPlan plan = plan(atomicCounters(), CORTEX_M0_PLUS);
		assertEquals(Arrays.asList(
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.LOCK_FREE_RETRY,
				SynchronizationStrategy.GLOBAL_DISABLE), mainStrategies(plan));
	}

	@Test
	public void noRetryNoMasking() {
		EmissionPlan plan = plan(atomicCounters(), CORTEX_M0);
		assertEquals(Collections.nCopies(4, SynchronizationStrategy.GLOBAL_DISABLE), mainStrategies(plan));
	}

	@Test
	public void operandWithCallIsMaskedNotRetried() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 2, "isr_handler")),
				Collections.singletonList(atomic("counter", CnxType.U32)),
				Collections.singleton("read_sensor"),
				function("main",
						assign("counter", "+<-", call("read_sensor")),
						assign("counter", "+<-", binop("*", num(2), num(3)))),
				function("isr_handler", assign("counter", "+<-", num(1))));
		EmissionPlan plan = plan(program, CORTEX_M4);

		AccessSiteEmission withCall = plan.getSites().get(0);
		assertEquals(SynchronizationStrategy.SELECTIVE_MASK, withCall.getStrategy());
		assertEquals(
				"uint32_t __cnx_basepri_1 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(2));",
				withCall.getEnter());
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_1);", withCall.getExit());

		AccessSiteEmission pure = plan.getSites().get(1);
		assertEquals(SynchronizationStrategy.LOCK_FREE_RETRY, pure.getStrategy());
		assertTrue(pure.getEnter().contains("__LDREXW(&counter)"));
	}

	@Test
	public void operandWithCallFallsBackToGlobalDisable() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 2, "isr_handler")),
				Collections.singletonList(atomic("counter", CnxType.U32)),
				Collections.singleton("read_sensor"),
				function("main", assign("counter", "+<-", call("read_sensor"))),
				function("isr_handler", assign("counter", "+<-", num(1))));
		EmissionPlan plan = plan(program, CORTEX_M0_PLUS);
		assertEquals(SynchronizationStrategy.GLOBAL_DISABLE, plan.getSites().get(0).getStrategy());
	}

	@Test
	public void singleAccessAtomics() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 2, "isr_handler")),
				Arrays.asList(atomic("word", CnxType.U32), atomic("wide", CnxType.U64)),
				function("main", Collections.singletonList("snapshot"),
						assign("word", num(5)),
						assign("snapshot", idexp("wide"))),
				function("isr_handler",
						assign("word", "+<-", num(1)),
						assign("wide", "+<-", num(1))));
		EmissionPlan plan = plan(program, CORTEX_M4);
		AccessSiteEmission wordWrite = plan.getSites().get(0);
		assertEquals(AccessOperation.WRITE, wordWrite.getSite().getOperation());
		assertEquals(SynchronizationStrategy.NONE, wordWrite.getStrategy());
		AccessSiteEmission wideRead = plan.getSites().get(1);
		assertEquals(AccessOperation.READ, wideRead.getSite().getOperation());
		assertEquals(SynchronizationStrategy.SELECTIVE_MASK, wideRead.getStrategy());
		assertEquals(Collections.singletonList(wideRead), plan.getProtectedSites());
	}

	@Test
	public void readOutsideRegionIsProtected() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 3, "isr_handler")),
				Collections.singletonList(shared("sample", CnxType.U16)),
				function("main", local("copy", idexp("sample"))),
				function("isr_handler", critical(assign("sample", num(7)))));
		EmissionPlan plan = plan(program, CORTEX_M0);
		AccessSiteEmission read = plan.getSites().get(0);
		assertEquals(SynchronizationStrategy.GLOBAL_DISABLE, read.getStrategy());
		assertEquals(3, read.getCeiling());
		assertEquals("uint32_t __cnx_primask_1 = __cnx_get_PRIMASK();\n__cnx_disable_irq();", read.getEnter());
	}

	@Test
	public void callerProtectsCoveredFunction() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 3, "isr_handler")),
				Collections.singletonList(shared("sample", CnxType.U16)),
				function("main", critical(callS("read_sample"))),
				function("read_sample", local("copy", idexp("sample"))),
				function("isr_handler", critical(assign("sample", num(7)))));
		EmissionPlan plan = plan(program, CORTEX_M4);
		AccessSiteEmission read = plan.getSites().get(0);
		assertEquals("read_sample", read.getSite().getOwningFunction());
		assertEquals(SynchronizationStrategy.NONE, read.getStrategy());
		assertTrue(read.isCoveredByCaller());
		assertEquals(3, plan.findRegion("main#1").get().getCeiling());
	}

	@Test
	public void planIsDeterministic() {
		EmissionPlan first = plan(atomicCounters(), CORTEX_M4);
		EmissionPlan second = plan(atomicCounters(), CORTEX_M4);
		assertEquals(first.getSites().size(), second.getSites().size());
		for (int i = 0; i < first.getSites().size(); ++i) {
			assertEquals(first.getSites().get(i).getEnter(), second.getSites().get(i).getEnter());
			assertEquals(first.getSites().get(i).getExit(), second.getSites().get(i).getExit());
		}
	}
}
