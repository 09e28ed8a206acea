package com.loanorigination.quality;

import java.time.LocalDate;

public record SubmittedDocument(String documentType, String filePath, LocalDate uploadDate) {
}
