package tdsc.blog.engagement.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import tdsc.blog.engagement.domain.User;

/**
 * MyBatis mapper for User operations
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user; the generated ID is written back to {@code user.userId}
     * @return number of rows affected
     */
    int insert(User user);

    /**
     * Find user by ID
     */
    User findById(@Param("userId") Long userId);

    /**
     * Find user by username (exact match)
     */
    User findByUsername(@Param("username") String username);

    /**
     * Find user by email (exact match)
     */
    User findByEmail(@Param("email") String email);
}
