package cnx.trans.passes.context;

import cnx.errors.TopLevelIssueContext;
import cnx.model.context.ContextKind;
import cnx.model.context.ContextRegistry;
import cnx.model.context.DuplicateContextIssue;
import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxProgram;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static cnx.model.program.CnxBuilder.*;
import static org.junit.Assert.*;

public class ContextRegistrationPassTest {

	@Test
	public void registersDeclaredContexts() {
		CnxProgram program = program(
				Arrays.asList(mainContext("main"), interrupt("isr", 4, "isr_handler")),
				Collections.emptyList(),
				function("main"), function("isr_handler"));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ContextRegistry registry = ContextRegistrationPass.perform(ctx, program);
		assertFalse(ctx.hasErrors());
		assertEquals(2, registry.getContexts().size());
		assertEquals(4, registry.getPriority("isr"));
		assertEquals(ContextKind.MAIN, registry.findByName("main").get().getKind());
	}

	@Test
	public void implicitMainContext() {
		CnxProgram program = program(
				Collections.singletonList(interrupt("isr", 2, "isr_handler")),
				Collections.emptyList(),
				function("main"), function("isr_handler"));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ContextRegistry registry = ContextRegistrationPass.perform(ctx, program);
		assertFalse(ctx.hasErrors());
		ExecutionContext main = registry.findByName(ContextRegistry.MAIN_CONTEXT_NAME).get();
		assertEquals(0, main.getPriority());
		assertEquals("main", main.getEntryFunction());
	}

	@Test
	public void duplicatesAreAllReported() {
		CnxProgram program = program(
				Arrays.asList(
						mainContext("main"),
						interrupt("isr", 1, "a"),
						interrupt("isr", 2, "b"),
						interrupt("isr", 3, "c")),
				Collections.emptyList(),
				function("main"), function("a"), function("b"), function("c"));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ContextRegistry registry = ContextRegistrationPass.perform(ctx, program);
		assertTrue(ctx.hasErrors());
		assertEquals(2, ctx.getIssues().size());
		for (Object issue : ctx.getIssues()) {
			assertTrue(issue instanceof DuplicateContextIssue);
		}
		// the first declaration wins
		assertEquals(1, registry.getPriority("isr"));
	}
}
