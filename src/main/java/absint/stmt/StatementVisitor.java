package absint.stmt;

/**
 * A visitor over every statement kind.
 */
public interface StatementVisitor<R, A> {
	R visitLiteralEvaluation(LiteralEvaluation stmt, A arg);

	R visitVariableAccess(VariableAccess stmt, A arg);

	R visitListDisplayAccess(ListDisplayAccess stmt, A arg);

	R visitSetDisplayAccess(SetDisplayAccess stmt, A arg);

	R visitDictDisplayAccess(DictDisplayAccess stmt, A arg);

	R visitSubscriptionAccess(SubscriptionAccess stmt, A arg);

	R visitSlicingAccess(SlicingAccess stmt, A arg);

	R visitAssignment(Assignment stmt, A arg);

	R visitCall(Call stmt, A arg);

	R visitRaise(Raise stmt, A arg);
}
