package com.milkledger.repository;

import com.milkledger.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * Custom Queries Explained:
 *
 * 1. findByEmail / existsByEmail
 *    Emails are normalized to lower case by UserService before they reach
 *    this layer, so an exact match is a case-insensitive match.
 *
 * 2. replaceRefreshToken(userId, expected, next)
 *    Compare-and-swap in one conditional UPDATE, atomic at row level.
 *    Two concurrent refreshes with the same token cannot both succeed:
 *      - Request A and B both present token R1
 *      - A's UPDATE matches (refresh_token = R1) → 1 row, column becomes R2
 *      - B's UPDATE no longer matches → 0 rows → B is rejected
 *
 * 3. storeRefreshToken / clearRefreshToken
 *    Unconditional writes used on login (rotation) and logout (revocation).
 *
 * Design Notes:
 * - No @Transactional here (service layer manages transaction boundaries)
 * - Bulk updates clear the persistence context so later reads see the new value
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find user by normalized email address.
     *
     * @param email lower-cased email
     * @return Optional containing User if found, empty otherwise
     */
    Optional<User> findByEmail(String email);

    /**
     * Check if a user exists with the given normalized email.
     */
    boolean existsByEmail(String email);

    /**
     * Rotate the refresh token only if the stored value still equals the
     * presented one.
     *
     * @return number of rows updated: 1 on success, 0 if the token is stale,
     *         revoked, or the user does not exist
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.refreshToken = :next " +
           "WHERE u.id = :userId AND u.refreshToken = :expected")
    int replaceRefreshToken(@Param("userId") Long userId,
                            @Param("expected") String expected,
                            @Param("next") String next);

    /**
     * Overwrite the refresh token regardless of its current value.
     *
     * @return number of rows updated (0 if the user does not exist)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.refreshToken = :token WHERE u.id = :userId")
    int storeRefreshToken(@Param("userId") Long userId, @Param("token") String token);

    /**
     * Remove the refresh token, ending the user's session.
     *
     * @return number of rows updated (0 if the user does not exist)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.refreshToken = NULL WHERE u.id = :userId")
    int clearRefreshToken(@Param("userId") Long userId);
}
