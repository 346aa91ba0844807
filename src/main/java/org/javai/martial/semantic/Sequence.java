package org.javai.martial.semantic;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;
import org.javai.martial.lang.Declaration.SequenceStep;
import org.javai.martial.lang.SourcePosition;

/**
 * A registered sequence: an ordered, connected chain of steps.
 */
public record Sequence(String name, List<SequenceStep> steps, SourcePosition position) {

	public Sequence {
		steps = List.copyOf(steps);
	}

	/**
	 * Index of the step performing {@code action}, if any.
	 */
	public OptionalInt stepIndex(String action) {
		return IntStream.range(0, steps.size())
				.filter(i -> steps.get(i).action().equals(action))
				.findFirst();
	}
}
