/*
The MIT License (MIT)

Copyright (c) 2025 Pierre Lindenbaum

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.


*/
package com.github.lindenb.jvarkit.variant.vbi.io;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import htsjdk.samtools.util.BinaryCodec;

/**
 * A typed value of a BCF record
 * @author Pierre Lindenbaum
 */
class BCFTypedData {
private static final int MAX_LENGTH=15;
private static final int bcf_float_missing_bits    = 0x7F800001;
private static final int bcf_float_vector_end_bits = 0x7F800002;
private static final int  bcf_int8_vector_end  = Byte.MIN_VALUE+1;
private static final int  bcf_int16_vector_end = Short.MIN_VALUE+1;
private static final int  bcf_int32_vector_end = Integer.MIN_VALUE+1;
private static final int  bcf_int8_missing  = Byte.MIN_VALUE;
private static final int  bcf_int16_missing = Short.MIN_VALUE;
private static final int  bcf_int32_missing = Integer.MIN_VALUE;
private static final byte  bcf_char_vector_end = (byte)0;

/** marker for an element that ends a vector before its declared size */
static final Object END_OF_VECTOR = new Object();

public static enum Type {
	MISSING(0,0),
	INT8(1,1),
	INT16(2,2),
	INT32(3,4),
	FLOAT(5,4),
	CHAR(7,1);

	final int opcode;
	final int sizeOf;
	Type(int opcode,int sizeOf) {
		this.opcode=opcode;
		this.sizeOf=sizeOf;
		}
	/** @return size in bytes of one element */
	public int getSizeOf() { return this.sizeOf;}
	}
private final Type type;
private final int count;
private final Object value;

BCFTypedData(Type type,int count,Object o) {
	this.type = type;
	this.count = count;
	this.value = o;
	}

public Type getType() {
	return type;
	}
public int getCount() {
	return count;
	}

/** @return null, a scalar, a String or a List of scalars */
public Object getValue() {
	return this.value;
	}
public boolean isNull() {
	return this.value==null;
	}
public boolean isList() {
	return this.value!=null && this.value instanceof List;
	}

public int intValue() {
	if(this.value==null || !(value instanceof Integer)) {
		throw new IllegalArgumentException("not an integer "+this.toString());
		}
	return Integer.class.cast(this.value);
	}

@Override
public String toString() {
	String s= "{type="+type.name()+",count="+this.count+",value=";
	if(value==null)
		{
		s+="null";
		}
	else if(value instanceof List)
		{
		List<?> L=(List<?>)this.value;
		s+= "["+L.stream().map(O->String.valueOf(O)).collect(Collectors.joining(","))+"]";
		}
	else
		{
		s+=String.valueOf(value);
		}
	s+="}";
	return s;
	}

static String readString(BinaryCodec bc,int length) {
	int i;
	final byte[] a=new byte[length];
	bc.readBytes(a);
	for(i=0;i< length;i++) {
		if(a[i]==bcf_char_vector_end) break;
		}
	return new String(a,0,i,StandardCharsets.UTF_8);
	}

/** read a typed string, a typed MISSING value gives an empty string */
static String readString(BinaryCodec bc) {
	final BCFTypedData td = read(bc);
	if(td.type==Type.MISSING) return "";
	if(td.type!=Type.CHAR) throw new IllegalStateException("expected CHAR but got "+td.type.name());
	return String.class.cast(td.value);
	}

static int[] readIntArray(BinaryCodec bc) {
	final BCFTypedData td = read(bc);
	switch(td.type) {
		case MISSING: return new int[0];
		case INT8:case INT16: case INT32:break;//ok
		default:throw new IllegalStateException("expected INT TYPE but got "+td.type.name());
		}
	if(td.isNull()) {
		return new int[0];
		}
	else if(td.isList()) {
		return ((List<?>)td.value).stream().
			filter(O->O!=null).
			mapToInt(O->Integer.class.cast(O).intValue()).
			toArray();
		}
	else
		{
		return new int[] {td.intValue()};
		}
	}

/**
 * read one element of a vector.
 * @return the value, null if missing or {@link #END_OF_VECTOR}
 */
static Object readAtomic(BinaryCodec bc,Type t) {
	switch(t) {
		case MISSING : return null;
		case INT8: return checkInt(bc.readByte(),bcf_int8_missing,bcf_int8_vector_end);
		case INT16: return checkInt(bc.readShort(),bcf_int16_missing,bcf_int16_vector_end);
		case INT32: return checkInt(bc.readInt(),bcf_int32_missing,bcf_int32_vector_end);
		case FLOAT: return checkFloat(bc.readInt());
		case CHAR: return String.valueOf((char)bc.readByte());
		default: throw new IllegalArgumentException("not int type:"+t);
	}
}

private static Object checkInt(int v,int missing,int vectorEnd) {
	if(v==vectorEnd) return END_OF_VECTOR;
	if(v==missing) return null;
	return Integer.valueOf(v);
	}

private static Object checkFloat(int bits) {
	if(bits==bcf_float_vector_end_bits) return END_OF_VECTOR;
	if(bits==bcf_float_missing_bits) return null;
	return Float.valueOf(Float.intBitsToFloat(bits));
	}

/** @return true if the raw bits of a float are the BCF 'missing' value */
static boolean isMissingFloat(float f) {
	return Float.floatToRawIntBits(f)==bcf_float_missing_bits;
	}

static BCFTypedData read(BinaryCodec bc) {
	final byte b = bc.readByte();
	return read(bc,b);
	}

static int decodeCount(BinaryCodec bc,byte b) {
	final int count0 = decodeSize(b);
	if(count0 >= MAX_LENGTH) {
		return read(bc).intValue();
		}
	return count0;
	}

static BCFTypedData read(BinaryCodec bc,byte b) {
	final Type t = decodeType(b);
	if(t==Type.MISSING) {
		return new BCFTypedData(t,decodeSize(b),null);
		}
	final int count = decodeCount(bc,b);
	if(t==Type.CHAR) {
		return new BCFTypedData(t,count,readString(bc,count));
		}
	if(count==0) {
		return new BCFTypedData(t,count,null);
		}
	if(count==1) {
		final Object o = readAtomic(bc,t);
		return new BCFTypedData(t,count,o==END_OF_VECTOR?null:o);
		}
	final List<Object> L=new ArrayList<>(count);
	boolean end=false;
	for(int i=0;i< count;i++) {
		// values after the end of vector must still be consumed
		final Object v= readAtomic(bc,t);
		if(v==END_OF_VECTOR) end=true;
		if(end) continue;
		L.add(v);
		}
	return new BCFTypedData(t,count,L);
	}

private static int decodeSize(final byte typeDescriptor) {
    return (0xF0 & typeDescriptor) >> 4;
}
static int decodeTypeID(final byte typeDescriptor) {
    return typeDescriptor & 0x0F;
}
static Type decodeType(final byte typeDescriptor) {
   final int t=decodeTypeID(typeDescriptor);
	   switch(t) {
	   case 0: return Type.MISSING;
	   case 1: return Type.INT8;
	   case 2 : return Type.INT16;
	   case 3: return Type.INT32;
	   case 5: return Type.FLOAT;
	   case 7: return Type.CHAR;
	   default: throw new IllegalArgumentException("undefined typeDescriptor:"+t);
	   }
	}
}
