package com.dcruver.medi.io;

public enum ExportFormat {
    MARKDOWN,
    JSON
}
