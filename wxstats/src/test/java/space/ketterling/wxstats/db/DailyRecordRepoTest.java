package space.ketterling.wxstats.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import space.ketterling.wxstats.db.DailyRecordRepo.StationYear;
import space.ketterling.wxstats.db.DailyRecordRepo.YearTotals;
import space.ketterling.wxstats.model.DailyRecord;

class DailyRecordRepoTest {
    private TestDatabase db;
    private DailyRecordRepo repo;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        repo = new DailyRecordRepo(db.ds());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void insertAllStoresRecordsWithCreationTime() throws Exception {
        repo.insertAll(List.of(
                rec("USC00110072", 2023, 1, 1, 100, -50, 25),
                rec("USC00110072", 2023, 1, 2, 150, 0, 0)));

        DailyRecord stored = repo.find("USC00110072", LocalDate.of(2023, 1, 1)).orElseThrow();
        assertThat(stored.maxTemp()).isEqualTo(100);
        assertThat(stored.minTemp()).isEqualTo(-50);
        assertThat(stored.precipitation()).isEqualTo(25);
        assertThat(stored.createdAt()).isNotNull();
        assertThat(repo.count(DailyRecordFilter.all())).isEqualTo(2);
    }

    @Test
    void insertAllIsAllOrNothing() throws Exception {
        repo.insert(rec("S1", 2023, 1, 2, 1, 1, 1));

        assertThatThrownBy(() -> repo.insertAll(List.of(
                rec("S1", 2023, 1, 1, 1, 1, 1),
                rec("S1", 2023, 1, 2, 9, 9, 9),
                rec("S1", 2023, 1, 3, 1, 1, 1))))
                .satisfies(e -> assertThat(SqlErrors.isUniqueViolation(e)).isTrue());

        assertThat(repo.count(DailyRecordFilter.station("S1"))).isEqualTo(1);
        assertThat(repo.find("S1", LocalDate.of(2023, 1, 2)).orElseThrow().maxTemp()).isEqualTo(1);
    }

    @Test
    void findReturnsEmptyWhenAbsent() throws Exception {
        assertThat(repo.find("NOPE", LocalDate.of(2000, 1, 1))).isEmpty();
    }

    @Test
    void listOrdersByDateDescThenStation() throws Exception {
        repo.insertAll(List.of(
                rec("B", 2020, 1, 1, 1, 1, 1),
                rec("A", 2020, 1, 1, 1, 1, 1),
                rec("A", 2020, 1, 2, 1, 1, 1),
                rec("C", 2019, 12, 31, 1, 1, 1)));

        List<DailyRecord> page = repo.list(DailyRecordFilter.all(), 0, 10);

        assertThat(page).extracting(r -> r.stationId() + "@" + r.date())
                .containsExactly("A@2020-01-02", "A@2020-01-01", "B@2020-01-01", "C@2019-12-31");
    }

    @Test
    void listFiltersAndPages() throws Exception {
        List<DailyRecord> rows = new ArrayList<>();
        for (int d = 1; d <= 10; d++)
            rows.add(rec("S1", 2021, 3, d, d, d, d));
        rows.add(rec("S2", 2021, 3, 5, 0, 0, 0));
        repo.insertAll(rows);

        DailyRecordFilter range = DailyRecordFilter.station("S1")
                .between(LocalDate.of(2021, 3, 3), LocalDate.of(2021, 3, 8));
        assertThat(repo.count(range)).isEqualTo(6);
        assertThat(repo.list(range, 0, 4)).extracting(DailyRecord::maxTemp).containsExactly(8, 7, 6, 5);
        assertThat(repo.list(range, 4, 4)).extracting(DailyRecord::maxTemp).containsExactly(4, 3);

        DailyRecordFilter day = DailyRecordFilter.all().onDate(LocalDate.of(2021, 3, 5));
        assertThat(repo.list(day, 0, 10)).extracting(DailyRecord::stationId).containsExactly("S1", "S2");
    }

    @Test
    void listRejectsBadPaging() {
        assertThatThrownBy(() -> repo.list(DailyRecordFilter.all(), -1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repo.list(DailyRecordFilter.all(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listCapsPageSize() throws Exception {
        List<DailyRecord> rows = new ArrayList<>();
        LocalDate d = LocalDate.of(2000, 1, 1);
        for (int i = 0; i < Paging.MAX_LIMIT + 5; i++)
            rows.add(new DailyRecord("S1", d.plusDays(i), 1, 1, 1));
        repo.insertAll(rows);

        assertThat(repo.list(DailyRecordFilter.all(), 0, 5000)).hasSize(Paging.MAX_LIMIT);
    }

    @Test
    void listsDistinctStationYears() throws Exception {
        repo.insertAll(List.of(
                rec("S2", 2001, 6, 1, 1, 1, 1),
                rec("S1", 2000, 1, 1, 1, 1, 1),
                rec("S1", 2000, 12, 31, 1, 1, 1),
                rec("S1", 2001, 1, 1, 1, 1, 1)));

        assertThat(repo.listStationYears(null)).containsExactly(
                new StationYear("S1", 2000), new StationYear("S1", 2001), new StationYear("S2", 2001));
        assertThat(repo.listStationYears("S2")).containsExactly(new StationYear("S2", 2001));
        assertThat(repo.listStationYears("NONE")).isEmpty();
    }

    @Test
    void yearTotalsSkipSentinelsAndStayInsideTheYear() throws Exception {
        repo.insertAll(List.of(
                rec("S1", 2023, 1, 1, 100, -50, 25),
                rec("S1", 2023, 1, 2, 150, 0, 0),
                rec("S1", 2023, 1, 3, -9999, -100, 50),
                rec("S1", 2022, 12, 31, 999, 999, 999),
                rec("S1", 2024, 1, 1, 999, 999, 999),
                rec("S2", 2023, 1, 1, 999, 999, 999)));

        YearTotals t;
        try (Connection c = db.ds().getConnection()) {
            t = repo.yearTotals(c, "S1", 2023);
        }

        assertThat(t).isEqualTo(new YearTotals(250, 2, -150, 3, 75, 3, 3));
    }

    @Test
    void yearTotalsForAllMissingValues() throws Exception {
        repo.insert(rec("S1", 2023, 5, 5, -9999, -9999, -9999));

        YearTotals t;
        try (Connection c = db.ds().getConnection()) {
            t = repo.yearTotals(c, "S1", 2023);
        }

        assertThat(t.maxTempCount()).isZero();
        assertThat(t.minTempCount()).isZero();
        assertThat(t.precipitationCount()).isZero();
        assertThat(t.days()).isEqualTo(1);
    }

    static DailyRecord rec(String station, int y, int m, int d, int max, int min, int prcp) {
        return new DailyRecord(station, LocalDate.of(y, m, d), max, min, prcp);
    }
}
