package com.content.visibility.user;

import com.content.visibility.core.model.InstanceScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryUserDirectory")
class InMemoryUserDirectoryTest {

    @Test
    @DisplayName("lists users in ascending id order")
    void sortedIds() {
        InMemoryUserDirectory users = new InMemoryUserDirectory().addUser(3).addUser(1).addUser(2);
        assertEquals(List.of(1L, 2L, 3L), List.copyOf(users.allUserIds()));
    }

    @Test
    @DisplayName("unknown users do not exist and see every instance")
    void unknownUser() {
        InMemoryUserDirectory users = new InMemoryUserDirectory();
        assertFalse(users.exists(5));
        assertTrue(users.instanceScope(5).isUnrestricted());
    }

    @Test
    @DisplayName("stores the instance scope per user")
    void scope() {
        InMemoryUserDirectory users = new InMemoryUserDirectory().addUser(1, InstanceScope.of("lib-a"));
        assertTrue(users.instanceScope(1).includes("lib-a"));
        assertFalse(users.instanceScope(1).includes("lib-b"));

        users.removeUser(1);
        assertFalse(users.exists(1));
    }
}
