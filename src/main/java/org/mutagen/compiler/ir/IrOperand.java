package org.mutagen.compiler.ir;

/**
 * Base type for instruction operands in the IR. Symbolic operands keep their
 * meaning until a backend pass resolves them.
 */
public sealed interface IrOperand permits IrImm, IrLocal, IrFieldRef, IrMethodRef, IrBranchTarget {}
