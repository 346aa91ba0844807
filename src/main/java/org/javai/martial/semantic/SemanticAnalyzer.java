package org.javai.martial.semantic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.martial.lang.Declaration.GroupDeclaration;
import org.javai.martial.lang.Declaration.RolesDeclaration;
import org.javai.martial.lang.Declaration.SequenceDeclaration;
import org.javai.martial.lang.Declaration.SequenceStep;
import org.javai.martial.lang.Declaration.StateDeclaration;
import org.javai.martial.lang.Declaration.StateRef;
import org.javai.martial.lang.DeclarationVisitor;
import org.javai.martial.lang.DeclarationWalker;
import org.javai.martial.lang.MartialFile;
import org.javai.martial.semantic.SemanticError.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the parsed files of one system and validates them against the martial model.
 * <p>
 * All files are first folded into one declaration stream; no file is privileged and
 * declarations have no file-scoped visibility. Validation then runs in phases:
 * <ol>
 * <li>role registration</li>
 * <li>state registration</li>
 * <li>role-compatibility of explicit state role lists</li>
 * <li>sequence and group registration and validation</li>
 * </ol>
 * Each phase reports every violation it finds. Analysis stops after the first phase
 * that reported anything, since later phases rely on the symbol tables built earlier.
 * <p>
 * This class is stateless; every call builds its symbol tables from scratch.
 */
public class SemanticAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

	/**
	 * Analyzes the given files as one system.
	 *
	 * @param systemName opaque label for the system, usually its directory name
	 * @param files parsed files in processing order
	 * @return the validated system, or every error of the first failing phase
	 */
	public AnalysisResult analyze(String systemName, List<MartialFile> files) {
		Objects.requireNonNull(systemName, "systemName must not be null");
		Objects.requireNonNull(files, "files must not be null");

		DeclarationCollector declarations = new DeclarationCollector();
		DeclarationWalker.walkAll(files, declarations);
		logger.debug("Merged {} file(s) of system '{}': {} roles block(s), {} state(s), {} sequence(s), {} group(s)",
				files.size(), systemName, declarations.roles.size(), declarations.states.size(),
				declarations.sequences.size(), declarations.groups.size());

		SymbolTables tables = new SymbolTables();
		List<SemanticError> errors = new ArrayList<>();

		registerRoles(declarations.roles, tables, errors);
		if (failed("role registration", errors)) {
			return AnalysisResult.failure(errors);
		}

		registerStates(declarations.states, tables, errors);
		if (failed("state registration", errors)) {
			return AnalysisResult.failure(errors);
		}

		validateStateRoles(tables, errors);
		if (failed("role compatibility", errors)) {
			return AnalysisResult.failure(errors);
		}

		registerSequences(declarations.sequences, tables, errors);
		registerGroups(declarations.groups, tables, errors);
		if (failed("sequence and group validation", errors)) {
			return AnalysisResult.failure(errors);
		}

		MartialSystem system = new MartialSystem(systemName, tables.roles, tables.states, tables.sequences, tables.groups);
		logger.debug("System '{}' is valid: {} role(s), {} state(s), {} sequence(s), {} group(s)", systemName,
				system.roles().size(), system.states().size(), system.sequences().size(), system.groups().size());
		return AnalysisResult.success(system);
	}

	private boolean failed(String phase, List<SemanticError> errors) {
		if (errors.isEmpty()) {
			logger.debug("Phase '{}' passed", phase);
			return false;
		}
		logger.debug("Phase '{}' reported {} error(s)", phase, errors.size());
		return true;
	}

	private void registerRoles(List<RolesDeclaration> rolesDeclarations, SymbolTables tables, List<SemanticError> errors) {
		for (RolesDeclaration declaration : rolesDeclarations) {
			for (String role : declaration.roles()) {
				if (!tables.roles.add(role)) {
					errors.add(new SemanticError(Kind.DUPLICATE_ROLE,
							"Role '" + role + "' is already declared", role, declaration.position()));
				}
			}
		}
		if (tables.roles.isEmpty()) {
			errors.add(new SemanticError(Kind.MISSING_ROLES,
					"No roles declared. At least one roles declaration is required.", null, null));
		}
	}

	private void registerStates(List<StateDeclaration> stateDeclarations, SymbolTables tables, List<SemanticError> errors) {
		for (StateDeclaration declaration : stateDeclarations) {
			if (tables.states.containsKey(declaration.name())) {
				errors.add(new SemanticError(Kind.DUPLICATE_STATE,
						"State '" + declaration.name() + "' is already declared at "
								+ tables.states.get(declaration.name()).position(),
						declaration.name(), declaration.position()));
				continue;
			}
			tables.states.put(declaration.name(),
					new State(declaration.name(), declaration.allowedRoles(), declaration.position()));
		}
	}

	private void validateStateRoles(SymbolTables tables, List<SemanticError> errors) {
		for (State state : tables.states.values()) {
			if (!state.hasExplicitRoles()) {
				continue;
			}
			Set<String> seen = new HashSet<>();
			for (String role : state.explicitRoles()) {
				if (!tables.roles.contains(role)) {
					errors.add(new SemanticError(Kind.UNDECLARED_ROLE,
							"Role '" + role + "' of state '" + state.name() + "' is not declared. Available roles: "
									+ String.join(", ", tables.roles),
							state.name(), state.position()));
				}
				if (!seen.add(role)) {
					errors.add(new SemanticError(Kind.DUPLICATE_STATE_ROLE,
							"Role '" + role + "' appears more than once in state '" + state.name() + "'",
							state.name(), state.position()));
				}
			}
		}
	}

	private void registerSequences(List<SequenceDeclaration> sequenceDeclarations, SymbolTables tables,
			List<SemanticError> errors) {
		for (SequenceDeclaration declaration : sequenceDeclarations) {
			if (tables.sequences.containsKey(declaration.name())) {
				errors.add(new SemanticError(Kind.DUPLICATE_SEQUENCE,
						"Sequence '" + declaration.name() + "' is already declared at "
								+ tables.sequences.get(declaration.name()).position(),
						declaration.name(), declaration.position()));
				continue;
			}
			validateSequence(declaration, tables, errors);
			tables.sequences.put(declaration.name(),
					new Sequence(declaration.name(), declaration.steps(), declaration.position()));
		}
	}

	private void validateSequence(SequenceDeclaration sequence, SymbolTables tables, List<SemanticError> errors) {
		Set<String> actions = new HashSet<>();
		List<SequenceStep> steps = sequence.steps();

		for (int i = 0; i < steps.size(); i++) {
			SequenceStep step = steps.get(i);
			if (!actions.add(step.action())) {
				errors.add(new SemanticError(Kind.DUPLICATE_ACTION,
						"Action '" + step.action() + "' appears more than once in sequence '" + sequence.name() + "'",
						step.action(), step.position()));
			}

			validateNodeReference(sequence, step, step.from(), tables, errors);
			validateNodeReference(sequence, step, step.to(), tables, errors);

			if (i > 0) {
				SequenceStep previous = steps.get(i - 1);
				if (!previous.to().sameNode(step.from())) {
					errors.add(new SemanticError(Kind.BROKEN_CHAIN,
							"Sequence '" + sequence.name() + "' is broken between actions '" + previous.action()
									+ "' and '" + step.action() + "': " + previous.action() + " ends at " + previous.to()
									+ " but " + step.action() + " starts at " + step.from(),
							previous.action() + " -> " + step.action(), step.position()));
				}
			}
		}
	}

	private void validateNodeReference(SequenceDeclaration sequence, SequenceStep step, StateRef ref,
			SymbolTables tables, List<SemanticError> errors) {
		String context = "action '" + step.action() + "' of sequence '" + sequence.name() + "'";
		State state = tables.states.get(ref.state());
		if (state == null) {
			errors.add(new SemanticError(Kind.UNDECLARED_STATE,
					"State '" + ref.state() + "' referenced by " + context + " is not declared",
					ref.state(), ref.position()));
			return;
		}
		if (!tables.roles.contains(ref.role())) {
			errors.add(new SemanticError(Kind.INVALID_NODE_REFERENCE,
					"Node " + ref + " referenced by " + context + " uses undeclared role '" + ref.role() + "'",
					ref.toString(), ref.position()));
			return;
		}
		if (!state.isCompatibleWith(ref.role(), tables.roles)) {
			errors.add(new SemanticError(Kind.INVALID_NODE_REFERENCE,
					"Node " + ref + " referenced by " + context + " is invalid: role '" + ref.role()
							+ "' is not allowed for state '" + ref.state() + "'. Allowed roles: "
							+ String.join(", ", state.compatibleRoles(tables.roles)),
					ref.toString(), ref.position()));
		}
	}

	private void registerGroups(List<GroupDeclaration> groupDeclarations, SymbolTables tables, List<SemanticError> errors) {
		for (GroupDeclaration declaration : groupDeclarations) {
			if (tables.groups.containsKey(declaration.name())) {
				errors.add(new SemanticError(Kind.DUPLICATE_GROUP,
						"Group '" + declaration.name() + "' is already declared at "
								+ tables.groups.get(declaration.name()).position(),
						declaration.name(), declaration.position()));
				continue;
			}
			if (declaration.states().isEmpty()) {
				errors.add(new SemanticError(Kind.EMPTY_GROUP,
						"Group '" + declaration.name() + "' must contain at least one state",
						declaration.name(), declaration.position()));
			}
			for (String member : declaration.states()) {
				if (!tables.states.containsKey(member)) {
					errors.add(new SemanticError(Kind.UNDECLARED_STATE,
							"State '" + member + "' of group '" + declaration.name() + "' is not declared",
							member, declaration.position()));
				}
			}
			tables.groups.put(declaration.name(),
					new Group(declaration.name(), declaration.states(), declaration.position()));
		}
	}

	/**
	 * Buckets the merged declaration stream by kind, keeping encounter order.
	 */
	private static final class DeclarationCollector implements DeclarationVisitor<Void> {
		final List<RolesDeclaration> roles = new ArrayList<>();
		final List<StateDeclaration> states = new ArrayList<>();
		final List<SequenceDeclaration> sequences = new ArrayList<>();
		final List<GroupDeclaration> groups = new ArrayList<>();

		@Override
		public Void visitRoles(RolesDeclaration declaration) {
			roles.add(declaration);
			return null;
		}

		@Override
		public Void visitState(StateDeclaration declaration) {
			states.add(declaration);
			return null;
		}

		@Override
		public Void visitSequence(SequenceDeclaration declaration) {
			sequences.add(declaration);
			return null;
		}

		@Override
		public Void visitGroup(GroupDeclaration declaration) {
			groups.add(declaration);
			return null;
		}
	}

	private static final class SymbolTables {
		final Set<String> roles = new LinkedHashSet<>();
		final Map<String, State> states = new LinkedHashMap<>();
		final Map<String, Sequence> sequences = new LinkedHashMap<>();
		final Map<String, Group> groups = new LinkedHashMap<>();
	}
}
