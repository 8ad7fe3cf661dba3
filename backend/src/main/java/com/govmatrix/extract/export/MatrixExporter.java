package com.govmatrix.extract.export;

import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.VotingMatrix;

import java.util.List;

public interface MatrixExporter {

    ExportResult export(ExportContext context, VotingMatrix matrix);

    /**
     * Best-effort dump of whatever was collected before a run failed. Never throws.
     */
    ExportResult emergencyExport(String slug, List<Delegate> delegates, List<Proposal> proposals);
}
