package absint.expr;

/**
 * A visitor over every expression shape.
 *
 * @param <R>
 *         The result type.
 * @param <A>
 *         The argument type.
 */
public interface ExpressionVisitor<R, A> {
	R visitLiteral(Literal expr, A arg);

	R visitVariableIdentifier(VariableIdentifier expr, A arg);

	R visitLengthIdentifier(LengthIdentifier expr, A arg);

	R visitKeysIdentifier(KeysIdentifier expr, A arg);

	R visitValuesIdentifier(ValuesIdentifier expr, A arg);

	R visitInput(Input expr, A arg);

	R visitListDisplay(ListDisplay expr, A arg);

	R visitSetDisplay(SetDisplay expr, A arg);

	R visitDictDisplay(DictDisplay expr, A arg);

	R visitRange(Range expr, A arg);

	R visitAttributeReference(AttributeReference expr, A arg);

	R visitSubscription(Subscription expr, A arg);

	R visitSlicing(Slicing expr, A arg);

	R visitUnaryArithmeticOperation(UnaryArithmeticOperation expr, A arg);

	R visitUnaryBooleanOperation(UnaryBooleanOperation expr, A arg);

	R visitBinaryArithmeticOperation(BinaryArithmeticOperation expr, A arg);

	R visitBinaryBooleanOperation(BinaryBooleanOperation expr, A arg);

	R visitBinaryComparisonOperation(BinaryComparisonOperation expr, A arg);
}
