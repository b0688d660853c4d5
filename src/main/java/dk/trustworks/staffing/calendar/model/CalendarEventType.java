package dk.trustworks.staffing.calendar.model;

public enum CalendarEventType {

    NATIONAL_HOLIDAY(true),
    COMPANY_CLOSURE(true),
    LOCAL_HOLIDAY(false);

    private final boolean companyWide;

    CalendarEventType(boolean companyWide) {
        this.companyWide = companyWide;
    }

    /**
     * Company-wide events close every location, local events only their own.
     */
    public boolean isCompanyWide() {
        return companyWide;
    }
}
