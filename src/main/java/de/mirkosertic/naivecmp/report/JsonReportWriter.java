package de.mirkosertic.naivecmp.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.naivecmp.ComparisonResult;

import java.io.IOException;
import java.io.Writer;

public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;
    private final boolean debug;

    public JsonReportWriter(final boolean debug) {
        this.debug = debug;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public void write(final ComparisonResult result, final Writer out) throws IOException {
        objectMapper.writeValue(out, ComparisonReport.from(result, debug));
        out.write(System.lineSeparator());
        out.flush();
    }
}
