package com.dps.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {
    public static final int DEFAULT_TYPE_ID = 71;
    private static final String DEFAULT_TIME_ZONE = "America/Chicago";

    private PersonalInfo personalInfo = new PersonalInfo();
    private Location location = new Location();
    private App app = new App();
    private Api api = new Api();
    private Cli cli = new Cli();

    public PersonalInfo getPersonalInfo() {
        return personalInfo;
    }

    public void setPersonalInfo(PersonalInfo personalInfo) {
        this.personalInfo = personalInfo;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public App getApp() {
        return app;
    }

    public void setApp(App app) {
        this.app = app;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Checks the settings the engine cannot run without and reports every problem in one message.
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        requireText(problems, "personal-info.first-name", personalInfo.getFirstName());
        requireText(problems, "personal-info.last-name", personalInfo.getLastName());
        requireText(problems, "personal-info.dob", personalInfo.getDob());
        requireText(problems, "personal-info.email", personalInfo.getEmail());
        String ssn = personalInfo.getLastFourSsn();
        if (ssn == null || !ssn.matches("\\d{4}")) {
            problems.add("personal-info.last-four-ssn must be exactly 4 digits");
        }

        if (location.getZipCodes().isEmpty()) {
            problems.add("location.zip-codes must list at least one zip code");
        }
        TimesAround times = location.getTimesAround();
        if (times.getStart() >= times.getEnd()) {
            problems.add("location.times-around.start must be before location.times-around.end");
        }
        DaysAround days = location.getDaysAround();
        if (days.getStart() > days.getEnd()) {
            problems.add("location.days-around.start must not exceed location.days-around.end");
        }
        if (days.getStartDate() != null && !days.getStartDate().isBlank()) {
            try {
                LocalDate.parse(days.getStartDate().trim());
            } catch (DateTimeParseException e) {
                problems.add("location.days-around.start-date must be an ISO date (yyyy-MM-dd)");
            }
        }
        for (Integer day : location.getPreferredDays()) {
            if (day == null || day < 0 || day > 6) {
                problems.add("location.preferred-days entries must be between 0 (Sunday) and 6 (Saturday)");
                break;
            }
        }
        try {
            ZoneId.of(app.getTimeZone());
        } catch (DateTimeException e) {
            problems.add("app.time-zone is not a known zone id: " + app.getTimeZone());
        }

        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
    }

    private static void requireText(List<String> problems, String name, String value) {
        if (value == null || value.isBlank()) {
            problems.add(name + " is required");
        }
    }

    public static class PersonalInfo {
        private String firstName;
        private String lastName;
        private String dob;
        private String lastFourSsn;
        private String phoneNumber;
        private String email;
        private int typeId = DEFAULT_TYPE_ID;

        public String getFirstName() {
            return firstName;
        }

        public void setFirstName(String firstName) {
            this.firstName = firstName;
        }

        public String getLastName() {
            return lastName;
        }

        public void setLastName(String lastName) {
            this.lastName = lastName;
        }

        public String getDob() {
            return dob;
        }

        public void setDob(String dob) {
            this.dob = dob;
        }

        public String getLastFourSsn() {
            return lastFourSsn;
        }

        public void setLastFourSsn(String lastFourSsn) {
            this.lastFourSsn = lastFourSsn == null ? null : lastFourSsn.trim();
        }

        public String getPhoneNumber() {
            return phoneNumber;
        }

        public void setPhoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
        }

        public boolean hasPhoneNumber() {
            return phoneNumber != null && !phoneNumber.isBlank();
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public int getTypeId() {
            return typeId > 0 ? typeId : DEFAULT_TYPE_ID;
        }

        public void setTypeId(int typeId) {
            this.typeId = typeId;
        }
    }

    public static class Location {
        private List<String> zipCodes = new ArrayList<>();
        private double miles = 25;
        private boolean pickLocation;
        private boolean sameDay;
        private List<Integer> preferredDays = new ArrayList<>();
        private DaysAround daysAround = new DaysAround();
        private TimesAround timesAround = new TimesAround();

        public List<String> getZipCodes() {
            return zipCodes;
        }

        public void setZipCodes(List<String> zipCodes) {
            this.zipCodes = zipCodes == null ? new ArrayList<>() : zipCodes;
        }

        public double getMiles() {
            return miles;
        }

        public void setMiles(double miles) {
            this.miles = Math.max(0, miles);
        }

        public boolean isPickLocation() {
            return pickLocation;
        }

        public void setPickLocation(boolean pickLocation) {
            this.pickLocation = pickLocation;
        }

        public boolean isSameDay() {
            return sameDay;
        }

        public void setSameDay(boolean sameDay) {
            this.sameDay = sameDay;
        }

        public List<Integer> getPreferredDays() {
            return preferredDays;
        }

        public void setPreferredDays(List<Integer> preferredDays) {
            this.preferredDays = preferredDays == null ? new ArrayList<>() : preferredDays;
        }

        public DaysAround getDaysAround() {
            return daysAround;
        }

        public void setDaysAround(DaysAround daysAround) {
            this.daysAround = daysAround;
        }

        public TimesAround getTimesAround() {
            return timesAround;
        }

        public void setTimesAround(TimesAround timesAround) {
            this.timesAround = timesAround;
        }
    }

    public static class DaysAround {
        private String startDate;
        private int start = 0;
        private int end = 30;

        public String getStartDate() {
            return startDate;
        }

        public void setStartDate(String startDate) {
            this.startDate = startDate;
        }

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = Math.max(0, start);
        }

        public int getEnd() {
            return end;
        }

        public void setEnd(int end) {
            this.end = Math.max(0, end);
        }
    }

    public static class TimesAround {
        private int start = 0;
        private int end = 24;

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = Math.min(24, Math.max(0, start));
        }

        public int getEnd() {
            return end;
        }

        public void setEnd(int end) {
            this.end = Math.min(24, Math.max(0, end));
        }
    }

    public static class App {
        private long intervalMs = 10_000;
        private int headersTimeoutMs = 20_000;
        private int maxRetry = 3;
        private boolean cancelIfExist;
        private boolean webserver;
        private String timeZone = DEFAULT_TIME_ZONE;
        private String cacheDir = "cache";

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = Math.max(0, intervalMs);
        }

        public int getHeadersTimeoutMs() {
            return headersTimeoutMs;
        }

        public void setHeadersTimeoutMs(int headersTimeoutMs) {
            this.headersTimeoutMs = Math.max(1, headersTimeoutMs);
        }

        public int getMaxRetry() {
            return maxRetry;
        }

        public void setMaxRetry(int maxRetry) {
            this.maxRetry = Math.max(0, maxRetry);
        }

        public boolean isCancelIfExist() {
            return cancelIfExist;
        }

        public void setCancelIfExist(boolean cancelIfExist) {
            this.cancelIfExist = cancelIfExist;
        }

        public boolean isWebserver() {
            return webserver;
        }

        public void setWebserver(boolean webserver) {
            this.webserver = webserver;
        }

        public String getTimeZone() {
            return timeZone == null || timeZone.isBlank() ? DEFAULT_TIME_ZONE : timeZone.trim();
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public String getCacheDir() {
            return cacheDir == null || cacheDir.isBlank() ? "cache" : cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
        }
    }

    public static class Api {
        private String baseUrl = "https://publicapi.txdpsscheduler.com";
        private String origin = "https://public.txdpsscheduler.com";
        private String publicSiteUrl = "https://public.txdpsscheduler.com";

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getOrigin() {
            return stripTrailingSlash(origin);
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public String getReferer() {
            return getOrigin() + "/";
        }

        public String getPublicSiteUrl() {
            return stripTrailingSlash(publicSiteUrl);
        }

        public void setPublicSiteUrl(String publicSiteUrl) {
            this.publicSiteUrl = publicSiteUrl;
        }

        private static String stripTrailingSlash(String value) {
            if (value == null) {
                return "";
            }
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }
    }

    public static class Cli {
        private boolean run;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }
    }
}
