package celldsl;

/**
 * One arm per command variant. Every pipeline pass implements all of them, so adding a variant fails the build
 * until each pass decides what to do with it.
 */
public interface CommandVisitor<R> {

    // ---------------- movement ----------------
    R visitMove(Command.Move c);

    R visitAtCell(Command.AtCell c);

    R visitBacktrack(Command.Backtrack c);

    R visitStackSave(Command.StackSave c);

    R visitStackLoad(Command.StackLoad c);

    R visitSave(Command.Save c);

    R visitLoad(Command.Load c);

    R visitSectionBegin(Command.SectionBegin c);

    R visitSectionEnd(Command.SectionEnd c);

    // ---------------- content ----------------
    R visitWrite(Command.Write c);

    R visitMergeWrite(Command.MergeWrite c);

    R visitWriteRich(Command.WriteRich c);

    R visitImposeStyle(Command.ImposeStyle c);

    R visitOverrideStyle(Command.OverrideStyle c);

    // ---------------- ranges ----------------
    R visitDrawBoxBorder(Command.DrawBoxBorder c);

    R visitDefineNamedRange(Command.DefineNamedRange c);

    R visitRefArray(Command.RefArray c);

    R visitAddConditionalFormat(Command.AddConditionalFormat c);

    // ---------------- sheet ----------------
    R visitSetRowHeight(Command.SetRowHeight c);

    R visitSetColWidth(Command.SetColWidth c);

    R visitSubmitRowBreak(Command.SubmitRowBreak c);

    R visitSubmitColBreak(Command.SubmitColBreak c);

    R visitApplyBreaks(Command.ApplyBreaks c);

    R visitAddComment(Command.AddComment c);

    R visitAddImage(Command.AddImage c);

    R visitAddChart(Command.AddChart c);
}
