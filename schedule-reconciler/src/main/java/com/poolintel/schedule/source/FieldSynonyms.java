package com.poolintel.schedule.source;

import java.util.List;

/**
 * Ordered upstream column names for each logical field. The first non-blank hit wins.
 * Shared by every adapter so new spellings are added in one place.
 */
public final class FieldSynonyms {

    public static final List<String> COURSE_TITLE = List.of("Course Title", "CourseName", "Course_Title", "Course");
    public static final List<String> CATEGORY = List.of("Category", "Section");
    public static final List<String> SCHEDULE = List.of("Schedule", "Days", "Day", "DayOftheWeek");
    public static final List<String> START_TIME = List.of("Start Time", "StartTime", "Start_Time");
    public static final List<String> END_TIME = List.of("End Time", "EndTime", "End_Time");
    public static final List<String> START_DATE = List.of("Start Date", "StartDate", "Date Range", "First Date");
    public static final List<String> END_DATE = List.of("End Date", "EndDate", "Last Date");
    public static final List<String> AGE_MIN = List.of("Age Min", "AgeMin", "Age_Min");
    public static final List<String> AGE_MAX = List.of("Age Max", "AgeMax", "Age_Max");
    public static final List<String> LOCATION_ID = List.of("Location ID", "LocationID", "Location_ID", "_id");
    public static final List<String> LOCATION_NAME = List.of("Location Name", "LocationName", "Location_Name");
    public static final List<String> ADDRESS = List.of("Address", "StreetAddress", "Street Address");
    public static final List<String> POSTAL_CODE = List.of("PostalCode", "Postal Code", "Postal_Code");

    private FieldSynonyms() {
    }
}
