package com.di.importgate.report;

import com.di.importgate.pipeline.RunWorkspace;

/**
 * Presents a finished result document, e.g. as console text or an HTML page.
 * Called once per run, after the document files are on disk.
 */
public interface ReportRenderer {

    void render(ResultDocument document, RunWorkspace workspace);
}
