package com.devflow.ingest.csv;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "devflow.ingest.csv")
public class CsvIngestProperties {

    private String caseColumn = "case_id";
    private String activityColumn = "activity";
    private String timestampColumn = "timestamp";
    private char separator = ',';

    public String getCaseColumn() {
        return caseColumn;
    }

    public void setCaseColumn(String caseColumn) {
        this.caseColumn = caseColumn;
    }

    public String getActivityColumn() {
        return activityColumn;
    }

    public void setActivityColumn(String activityColumn) {
        this.activityColumn = activityColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public void setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    public char getSeparator() {
        return separator;
    }

    public void setSeparator(char separator) {
        this.separator = separator;
    }
}
