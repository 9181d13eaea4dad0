package com.weatherdesk.backend.service;

import com.weatherdesk.backend.dto.UserSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserDirectoryServiceTest {

    @TempDir
    Path dir;

    private ConnectionPool pool;
    private UserDirectoryService directory;

    @BeforeEach
    void setUp() throws Exception {
        pool = TestDatabases.pool(dir, 2);
        TestDatabases.createSchema(pool);
        long id = 1;
        for (String name : List.of("anna", "andrew", "annabel", "bob", "an_ne", "anxious", "carl")) {
            TestDatabases.insertUser(pool, id++, name, "pbkdf2$1$AA==$AA==");
        }
        directory = new UserDirectoryService(pool, TestDatabases.SETTINGS);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void prefixSearchIsOrderedById() {
        List<UserSummary> users = directory.search("ann", 1, 50);

        assertEquals(List.of("anna", "annabel"), users.stream().map(UserSummary::username).toList());
        assertEquals(new UserSummary(1, "anna", "anna@example.com"), users.get(0));
    }

    @Test
    void paginatesWithLimitAndPage() {
        List<UserSummary> first = directory.search("an", 1, 2);
        List<UserSummary> second = directory.search("an", 2, 2);
        List<UserSummary> third = directory.search("an", 3, 2);

        assertEquals(List.of("anna", "andrew"), first.stream().map(UserSummary::username).toList());
        assertEquals(List.of("annabel", "an_ne"), second.stream().map(UserSummary::username).toList());
        assertEquals(List.of("anxious"), third.stream().map(UserSummary::username).toList());
        assertTrue(directory.search("an", 4, 2).isEmpty());
    }

    @Test
    void wildcardsInPrefixAreLiteral() {
        assertEquals(List.of("an_ne"),
                directory.search("an_", 1, 50).stream().map(UserSummary::username).toList());
        assertTrue(directory.search("%", 1, 50).isEmpty());
    }

    @Test
    void missingPrefixListsEveryoneAndClampsArguments() {
        assertEquals(7, directory.search(null, 1, 50).size());
        assertEquals(7, directory.search("  ", 0, 1000).size());
        assertEquals(1, directory.search(null, -3, 0).size());
        assertEquals(2, pool.freeCount());
    }
}
