package com.notice.evaluation;

import com.notice.evaluation.model.NoticeRecord;

/**
 * Sample notice rows shared by the tests.
 */
public final class TestRecords {

    private TestRecords() {
    }

    public static NoticeRecord disconnect(String pdfName) {
        return NoticeRecord.builder()
                .pdfName(pdfName)
                .vendorAccountNumber("4410-2231-09")
                .vendorName("Metro Electric Co")
                .serviceAddress("12 Harbor Rd, Unit 3")
                .noticeCategory("Disconnect Notice")
                .noticeDate("2024-03-01")
                .impactDate("2024-03-21")
                .impactAmount("$412.80")
                .build();
    }

    public static NoticeRecord maintenance(String pdfName) {
        return NoticeRecord.builder()
                .pdfName(pdfName)
                .vendorAccountNumber("88172")
                .vendorName("City Water Dept")
                .serviceAddress("400 Elm St")
                .noticeCategory("Maintenance")
                .noticeDate("2024-02-10")
                .impactDate("NA")
                .impactAmount("NA")
                .build();
    }
}
