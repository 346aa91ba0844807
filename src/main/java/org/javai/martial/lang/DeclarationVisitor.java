package org.javai.martial.lang;

/**
 * Visitor interface for traversing martial declarations.
 *
 * @param <R> the return type of the visitor operations
 */
public interface DeclarationVisitor<R> {

	R visitRoles(Declaration.RolesDeclaration roles);

	R visitState(Declaration.StateDeclaration state);

	R visitSequence(Declaration.SequenceDeclaration sequence);

	R visitGroup(Declaration.GroupDeclaration group);
}
