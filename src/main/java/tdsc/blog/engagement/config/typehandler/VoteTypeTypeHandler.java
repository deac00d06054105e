package tdsc.blog.engagement.config.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;
import tdsc.blog.engagement.enums.VoteType;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * MyBatis TypeHandler for VoteType enum
 * Stores the lowercase wire value ("up" / "down") in a VARCHAR column
 */
@MappedTypes(VoteType.class)
public class VoteTypeTypeHandler extends BaseTypeHandler<VoteType> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, VoteType parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, parameter.getValue());
    }

    @Override
    public VoteType getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toVoteType(rs.getString(columnName));
    }

    @Override
    public VoteType getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toVoteType(rs.getString(columnIndex));
    }

    @Override
    public VoteType getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toVoteType(cs.getString(columnIndex));
    }

    private static VoteType toVoteType(String value) {
        return value == null ? null : VoteType.fromValue(value);
    }
}
